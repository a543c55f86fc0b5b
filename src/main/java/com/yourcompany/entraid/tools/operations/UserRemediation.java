package com.yourcompany.entraid.tools.operations;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.identityconnectors.common.StringUtil;
import org.identityconnectors.common.logging.Log;

import com.yourcompany.entraid.tools.GraphRestClient;
import com.yourcompany.entraid.tools.model.AssignedLicense;
import com.yourcompany.entraid.tools.model.AuthenticationMethod;
import com.yourcompany.entraid.tools.model.DirectoryUser;
import com.yourcompany.entraid.tools.pipeline.PaginatedFetcher;

/**
 * Account remediation actions for a single user.
 * <p>
 * Every method fails with a
 * {@link com.yourcompany.entraid.tools.GraphRequestException} carrying
 * Graph's response verbatim when a mutating call is rejected.
 * </p>
 */
public class UserRemediation {

    private static final Log LOG = Log.getLog(UserRemediation.class);

    private final GraphRestClient client;

    public UserRemediation(GraphRestClient client) {
        this.client = client;
    }

    private static String userPath(String userPrincipalName) {
        if (StringUtil.isBlank(userPrincipalName)) {
            throw new IllegalArgumentException("User principal name cannot be null or empty");
        }
        return "/users/" + GraphRestClient.segment(userPrincipalName);
    }

    /**
     * Invalidates every refresh token and session cookie issued to the user.
     */
    public void revokeSignInSessions(String userPrincipalName) {
        String path = userPath(userPrincipalName) + "/revokeSignInSessions";
        LOG.ok("Revoking sign-in sessions at {0}", path);
        client.post(path, Map.of());
        LOG.info("Sign-in sessions revoked successfully for user {0}", userPrincipalName);
    }

    /**
     * Lists the registered authentication methods of the user.
     */
    public List<AuthenticationMethod> listAuthenticationMethods(String userPrincipalName) {
        LOG.info("Retrieving authentication methods for user: {0}", userPrincipalName);
        return new PaginatedFetcher<>(client, AuthenticationMethod.class)
                .fetchAll(userPath(userPrincipalName) + "/authentication/methods");
    }

    /**
     * Deletes every software OATH (authenticator app) method so the user has
     * to register MFA again. Other method types are left in place. Stops at
     * the first failed delete.
     *
     * @return The deleted methods.
     */
    public List<AuthenticationMethod> requireMfaReregistration(String userPrincipalName) {
        LOG.info("Requiring MFA re-registration for user {0}", userPrincipalName);
        List<AuthenticationMethod> deleted = new ArrayList<>();
        for (AuthenticationMethod method : listAuthenticationMethods(userPrincipalName)) {
            if (!method.isSoftwareOath()) {
                LOG.ok("Ignoring unsupported method type: {0}", method.getOdataType());
                continue;
            }
            LOG.info("Deleting authentication method {0} for user {1}", method.getId(), userPrincipalName);
            client.delete(userPath(userPrincipalName) + "/authentication/softwareOathMethods/"
                    + GraphRestClient.segment(method.getId()));
            deleted.add(method);
        }
        LOG.info("MFA re-registration required for user {0}, {1} methods deleted", userPrincipalName,
                deleted.size());
        return deleted;
    }

    /**
     * @return The SKU ids of every license assigned to the user.
     */
    public List<String> assignedLicenses(String userPrincipalName) {
        DirectoryUser user = client.getJson(userPath(userPrincipalName) + "?$select=id,userPrincipalName,assignedLicenses",
                DirectoryUser.class);
        return user.getAssignedLicenses().stream()
                .map(AssignedLicense::getSkuId)
                .collect(Collectors.toList());
    }

    /**
     * Removes every assigned license from the user.
     *
     * @return The removed SKU ids; empty if the user had none, in which case nothing is sent.
     */
    public List<String> removeAllLicenses(String userPrincipalName) {
        List<String> skuIds = assignedLicenses(userPrincipalName);
        if (skuIds.isEmpty()) {
            LOG.info("User {0} has no licenses to remove", userPrincipalName);
            return skuIds;
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("addLicenses", List.of());
        body.put("removeLicenses", skuIds);
        client.post(userPath(userPrincipalName) + "/assignLicense", body);
        LOG.info("Removed {0} licenses from user {1}", skuIds.size(), userPrincipalName);
        return skuIds;
    }
}
