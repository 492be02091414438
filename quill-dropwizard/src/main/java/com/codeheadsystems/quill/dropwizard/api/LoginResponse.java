package com.codeheadsystems.quill.dropwizard.api;

import com.codeheadsystems.quill.server.model.AccountView;

/**
 * Login response body.
 *
 * @param token   bearer token for the {@code Authorization} header
 * @param account the logged-in account
 */
public record LoginResponse(String token, AccountView account) {
}
