package io.krpc.server.core;

import io.krpc.server.spi.ClientInfo;
import io.krpc.server.spi.DisconnectReason;
import io.krpc.server.spi.ServerListener;

import java.util.ArrayList;
import java.util.List;

final class RecordingListener implements ServerListener {

    final List<String> events = new ArrayList<>();
    final List<DisconnectReason> disconnects = new ArrayList<>();

    @Override
    public void onServerStarted() {
        events.add("started");
    }

    @Override
    public void onServerStopped() {
        events.add("stopped");
    }

    @Override
    public void onClientConnected(ClientInfo client) {
        events.add("connected:" + client.name());
    }

    @Override
    public void onClientDisconnected(ClientInfo client, DisconnectReason reason) {
        events.add("disconnected:" + client.name() + ":" + reason);
        disconnects.add(reason);
    }
}
