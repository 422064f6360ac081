package com.portfoliosync.broker;

import com.portfoliosync.domain.model.LoginCredentials;

/** Drives the broker's interactive login and returns a fresh request token. */
@FunctionalInterface
public interface LoginAutomation {

    String obtainRequestToken(LoginCredentials credentials);
}
