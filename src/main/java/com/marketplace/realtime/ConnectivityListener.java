package com.marketplace.realtime;

@FunctionalInterface
public interface ConnectivityListener {

    void onConnectivityChanged(ConnectivityState previous, ConnectivityState current);
}
