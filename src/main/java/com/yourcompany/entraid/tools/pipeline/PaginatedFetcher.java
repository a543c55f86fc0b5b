package com.yourcompany.entraid.tools.pipeline;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.identityconnectors.common.StringUtil;
import org.identityconnectors.common.logging.Log;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.yourcompany.entraid.tools.FetchException;
import com.yourcompany.entraid.tools.GraphRequestException;
import com.yourcompany.entraid.tools.GraphRestClient;

/**
 * Walks a cursor-linked Graph collection ({@code @odata.nextLink}) one page at a time.
 * <p>
 * Requests are strictly sequential. Any failed page aborts the whole listing
 * with a {@link FetchException}; nothing is retried here.
 * </p>
 *
 * @param <T> Record type of the collection.
 */
public class PaginatedFetcher<T> {

    private static final Log LOG = Log.getLog(PaginatedFetcher.class);

    private final GraphRestClient client;
    private final JavaType pageType;
    private final CancellationSignal cancellation;
    private final boolean eventualConsistency;

    public PaginatedFetcher(GraphRestClient client, Class<T> recordType) {
        this(client, recordType, new CancellationSignal(), false);
    }

    /**
     * @param client              The authenticated client.
     * @param recordType          Type each element of {@code value} maps onto.
     * @param cancellation        Checked before every page request.
     * @param eventualConsistency Whether to send {@code ConsistencyLevel: eventual} (needed by {@code $search}).
     */
    public PaginatedFetcher(GraphRestClient client, Class<T> recordType, CancellationSignal cancellation,
            boolean eventualConsistency) {
        this.client = client;
        this.pageType = client.getObjectMapper().getTypeFactory().constructParametricType(Page.class, recordType);
        this.cancellation = cancellation;
        this.eventualConsistency = eventualConsistency;
    }

    /**
     * Returns a lazy, single-use iterator over every record of every page, in
     * server order. Pages are requested as the iterator advances.
     *
     * @param startUrl Graph path or absolute URL of the first page.
     * @throws IllegalArgumentException if {@code startUrl} is blank or malformed.
     */
    public Iterator<T> iterate(String startUrl) {
        if (StringUtil.isBlank(startUrl)) {
            throw new IllegalArgumentException("Start URL cannot be null or empty");
        }
        try {
            URI.create(client.resolve(startUrl));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Malformed start URL: " + startUrl, e);
        }
        return new PageIterator(client.resolve(startUrl));
    }

    /**
     * Materializes the whole collection.
     *
     * @param startUrl Graph path or absolute URL of the first page.
     * @return Every record, page by page, in server order.
     * @throws FetchException if any page failed; records of earlier pages are discarded.
     */
    public List<T> fetchAll(String startUrl) {
        List<T> records = new ArrayList<>();
        iterate(startUrl).forEachRemaining(records::add);
        LOG.ok("Total number of records fetched from {0}: {1}", startUrl, records.size());
        return records;
    }

    Page<T> fetchPage(String url) {
        String body;
        try {
            body = client.get(url, eventualConsistency);
        } catch (GraphRequestException e) {
            throw FetchException.fromRequest(url, e);
        }

        Page<T> page;
        try {
            page = client.getObjectMapper().readValue(body, pageType);
        } catch (JsonProcessingException e) {
            throw FetchException.decode(url, e.getOriginalMessage(), e);
        }
        if (page == null || page.getValue() == null) {
            throw FetchException.decode(url, "response has no 'value' array", null);
        }
        if (page.getValue().contains(null)) {
            throw FetchException.decode(url, "null element in 'value'", null);
        }
        return page;
    }

    private final class PageIterator implements Iterator<T> {

        private String nextUrl;
        private Iterator<T> current = Collections.emptyIterator();
        private int pageCount;

        PageIterator(String startUrl) {
            this.nextUrl = startUrl;
        }

        @Override
        public boolean hasNext() {
            while (!current.hasNext() && nextUrl != null) {
                advance();
            }
            return current.hasNext();
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.next();
        }

        private void advance() {
            cancellation.throwIfCancelled("page " + (pageCount + 1));
            pageCount++;
            String url = nextUrl;
            LOG.ok("Fetching {0} (page {1})", url, pageCount);

            Page<T> page = fetchPage(url);
            LOG.ok("Number of records on page {0}: {1}", pageCount, page.getValue().size());

            if (page.hasNextLink()) {
                if (page.getNextLink().equals(url)) {
                    throw FetchException.decode(url, "next link points back to the same page", null);
                }
                nextUrl = page.getNextLink();
            } else {
                LOG.ok("No more pages after page {0}", pageCount);
                nextUrl = null;
            }
            current = page.getValue().iterator();
        }
    }
}
