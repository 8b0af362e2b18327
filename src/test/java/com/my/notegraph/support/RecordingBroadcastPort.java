package com.my.notegraph.support;

import com.my.notegraph.domain.model.GraphDelta;
import com.my.notegraph.domain.port.out.GraphBroadcastPort;

import java.util.ArrayList;
import java.util.List;

public class RecordingBroadcastPort implements GraphBroadcastPort {

    private final List<GraphDelta> deltas = new ArrayList<>();
    private int clears;

    @Override
    public void broadcast(GraphDelta delta) {
        deltas.add(delta);
    }

    @Override
    public void clear() {
        clears++;
    }

    public List<GraphDelta> deltas() {
        return deltas;
    }

    public GraphDelta last() {
        return deltas.get(deltas.size() - 1);
    }

    public int clears() {
        return clears;
    }
}
