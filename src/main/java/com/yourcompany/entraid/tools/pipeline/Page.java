package com.yourcompany.entraid.tools.pipeline;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One page of a Graph collection: {@code {"value": [...], "@odata.nextLink": "..."}}.
 *
 * @param <T> Record type.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Page<T> {

    private final List<T> value;
    private final String nextLink;

    @JsonCreator
    public Page(@JsonProperty("value") List<T> value, @JsonProperty("@odata.nextLink") String nextLink) {
        this.value = value;
        this.nextLink = nextLink;
    }

    /**
     * @return The records of this page, {@code null} if the body carried no {@code value} array.
     */
    public List<T> getValue() {
        return value;
    }

    /**
     * @return The cursor of the next page, {@code null} on the last page.
     */
    public String getNextLink() {
        return nextLink;
    }

    public boolean hasNextLink() {
        return nextLink != null && !nextLink.isEmpty();
    }
}
