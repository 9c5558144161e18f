package com.bringabrain.link.ble.radio;

/**
 * Hook invoked when the radio leaves {@link RadioState#POWERED_ON}. Connection
 * managers use it to stop advertising or scanning and to fail every live peer.
 */
@FunctionalInterface
public interface RadioLostHandler
{
    void onRadioLost(RadioState newState);
}
