package com.codeheadsystems.quill.server.manager;

import com.codeheadsystems.quill.server.model.AccountView;

/**
 * Outcome of a successful login.
 *
 * @param token   signed bearer token
 * @param account the account without its password hash
 */
public record LoginResult(String token, AccountView account) {
}
