package com.my.notegraph.adapter.out.broadcast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.notegraph.domain.model.GraphDelta;
import com.my.notegraph.domain.port.out.GraphBroadcastPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Channel;
import org.eclipse.microprofile.reactive.messaging.Emitter;
import org.jboss.logging.Logger;

/**
 * 왜: 델타를 UI와 에디터 협력자에게 전달하는 RabbitMQ 드리븐 어댑터를 도메인에서 분리하기 위함.
 */
@ApplicationScoped
public class GraphDeltaBroadcaster implements GraphBroadcastPort {

    private static final Logger log = Logger.getLogger(GraphDeltaBroadcaster.class);

    private final Emitter<String> emitter;
    private final ObjectMapper objectMapper;

    @Inject
    public GraphDeltaBroadcaster(@Channel("graph-deltas") Emitter<String> emitter, ObjectMapper objectMapper) {
        this.emitter = emitter;
        this.objectMapper = objectMapper;
    }

    @Override
    public void broadcast(GraphDelta delta) {
        if (delta.isEmpty()) {
            return;
        }
        send(GraphDeltaPayload.of(delta));
        log.debugf("그래프 델타 전송: 연산 %d개", delta.size());
    }

    @Override
    public void clear() {
        send(GraphDeltaPayload.clear());
    }

    private void send(GraphDeltaPayload payload) {
        try {
            emitter.send(objectMapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            log.warnf("그래프 델타 직렬화 실패: %s", e.getMessage());
        }
    }
}
