package com.ldap.searchfilter.transform;

public enum ExtensibleMatchFilterScope {
    /** Delete unsupported rules without a period. */
    REMOVE,
    /** Replace unsupported rules containing a period with {@code :.:}. */
    REDACT
}
