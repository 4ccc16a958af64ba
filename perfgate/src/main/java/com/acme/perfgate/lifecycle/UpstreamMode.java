package com.acme.perfgate.lifecycle;

/**
 * How the subject is wired to the simulator: one service, or two services behind an alias.
 */
public enum UpstreamMode {
    SINGLE,
    ALIAS_GROUP
}
