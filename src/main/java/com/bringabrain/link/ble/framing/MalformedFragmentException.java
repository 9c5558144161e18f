package com.bringabrain.link.ble.framing;

/**
 * Indicates that a received channel value cannot be read as a fragment, or
 * that its header contradicts itself or an already-open buffer.
 *
 * <p>Always local to one sender's stream: the fragment is dropped and no
 * other state changes.</p>
 */
public final class MalformedFragmentException extends Exception
{
    public MalformedFragmentException(String message) {
        super(message);
    }
}
