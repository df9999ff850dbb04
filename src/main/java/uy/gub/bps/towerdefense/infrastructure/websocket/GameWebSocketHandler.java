package uy.gub.bps.towerdefense.infrastructure.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.msgpack.jackson.dataformat.MessagePackFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;
import uy.gub.bps.towerdefense.domain.event.GameEvent;
import uy.gub.bps.towerdefense.domain.model.CommandFailure;
import uy.gub.bps.towerdefense.domain.model.InputMessage;
import uy.gub.bps.towerdefense.domain.model.SimulationSnapshot;
import uy.gub.bps.towerdefense.domain.service.GameSession;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Clients send {@link InputMessage}s as JSON or MessagePack; they are queued for the game loop, never applied
 * on the socket thread. State goes out as MessagePack.
 */
@Slf4j
@Component
public class GameWebSocketHandler extends AbstractWebSocketHandler {

    private final GameSession gameSession;
    private final ObjectMapper jsonMapper;
    private final ObjectMapper msgPackMapper;
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private final Queue<QueuedCommand> commands = new ConcurrentLinkedQueue<>();
    private final Queue<GameEvent<?>> pendingEvents = new ConcurrentLinkedQueue<>();

    public GameWebSocketHandler(GameSession gameSession) {
        this.gameSession = gameSession;
        this.jsonMapper = new ObjectMapper();
        this.msgPackMapper = new ObjectMapper(new MessagePackFactory());
        gameSession.addListener(pendingEvents::add);
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        sessions.put(session.getId(), session);
        byte[] payload = msgPackMapper.writeValueAsBytes(Map.of(
            "t", "WELCOME",
            "sid", session.getId()
        ));
        session.sendMessage(new BinaryMessage(payload));
        log.info("New connection: {}", session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        handleInput(session, message.getPayload().getBytes(StandardCharsets.UTF_8));
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) throws Exception {
        byte[] payload = new byte[message.getPayload().remaining()];
        message.getPayload().get(payload);
        handleInput(session, payload);
    }

    private void handleInput(WebSocketSession session, byte[] payload) throws IOException {
        InputMessage input;
        if (payload.length > 0 && payload[0] == '{') {
            input = jsonMapper.readValue(payload, InputMessage.class);
        } else {
            input = msgPackMapper.readValue(payload, InputMessage.class);
        }
        CommandTranslator.translate(session.getId(), input).ifPresent(commands::add);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) throws Exception {
        sessions.remove(session.getId());
        log.info("Connection closed: {}", session.getId());
    }

    /** Next queued command, or {@code null}. Called from the game loop only. */
    public QueuedCommand pollCommand() {
        return commands.poll();
    }

    public int queuedCommands() {
        return commands.size();
    }

    public void reject(String sessionId, String command, CommandFailure failure) {
        WebSocketSession session = sessions.get(sessionId);
        if (session == null || !session.isOpen()) {
            return;
        }
        try {
            byte[] payload = msgPackMapper.writeValueAsBytes(Map.of(
                "t", "REJECTED",
                "c", command,
                "f", failure.name()
            ));
            session.sendMessage(new BinaryMessage(payload));
        } catch (Exception e) {
            log.error("Error sending message to session {}: {}", sessionId, e.getMessage());
        }
    }

    public void broadcastState() {
        List<GameEvent<?>> events = new ArrayList<>();
        GameEvent<?> event;
        while ((event = pendingEvents.poll()) != null) {
            events.add(event);
        }
        SimulationSnapshot snapshot = gameSession.getLastSnapshot();
        if (snapshot == null) {
            return;
        }
        try {
            byte[] payload = msgPackMapper.writeValueAsBytes(StateMessage.of(snapshot, events));
            sessions.forEach((sessionId, session) -> {
                if (session.isOpen()) {
                    try {
                        session.sendMessage(new BinaryMessage(payload));
                    } catch (Exception e) {
                        log.error("Error sending message to session {}: {}", sessionId, e.getMessage());
                    }
                }
            });
        } catch (Exception e) {
            log.error("Error broadcasting state: {}", e.getMessage());
        }
    }
}
