package com.bringabrain.link.api;

/**
 * Role of the <em>other</em> side of a connection, from this device's
 * perspective.
 */
public enum PeerRole
{
    /** The remote device advertises the session and accepts connections. */
    HOST,

    /** The remote device scanned for and connected to this device. */
    JOINER
}
