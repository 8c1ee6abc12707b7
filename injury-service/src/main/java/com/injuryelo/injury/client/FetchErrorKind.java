package com.injuryelo.injury.client;

public enum FetchErrorKind {
    TIMEOUT,
    NETWORK,
    HTTP_STATUS,
    PARSE,
    UNKNOWN_TEAM
}
