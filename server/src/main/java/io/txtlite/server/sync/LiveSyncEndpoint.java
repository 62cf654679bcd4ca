// file: server/src/main/java/io/txtlite/server/sync/LiveSyncEndpoint.java
package io.txtlite.server.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.txtlite.server.dto.SyncMessage;
import io.txtlite.server.dto.SyncReply;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.xnio.IoUtils;

import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Undertow WebSocket adapter: one {@link LiveSyncSession} per connection.
 * <p>
 * Each text frame is a JSON {@link SyncMessage}; each gets exactly one JSON
 * {@link SyncReply}. Unreadable frames or failed writes end the connection,
 * which runs the session's close step.
 * <p>
 * Decoding, saving and the close step run on the XNIO worker pool, never on
 * the IO thread, in the order the frames arrived on the connection.
 */
public final class LiveSyncEndpoint implements WebSocketConnectionCallback {
    private static final Logger log = Logger.getLogger(LiveSyncEndpoint.class.getName());

    private final ObjectMapper json;
    private final Supplier<LiveSyncSession> sessions;

    public LiveSyncEndpoint(ObjectMapper json, Supplier<LiveSyncSession> sessions) {
        this.json = Objects.requireNonNull(json, "json");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
    }

    @Override
    public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
        LiveSyncSession session = sessions.get();
        OrderedDispatcher dispatcher = new OrderedDispatcher(channel.getWorker());
        log.fine(() -> "live-sync connection from " + channel.getSourceAddress());

        channel.addCloseTask(ch -> dispatch(dispatcher, ch, session::onClose));
        channel.getReceiveSetter().set(new AbstractReceiveListener() {
            @Override
            protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                String frame = message.getData();
                dispatch(dispatcher, ch, () -> handleFrame(session, ch, frame));
            }
        });
        channel.resumeReceives();
    }

    private void handleFrame(LiveSyncSession session, WebSocketChannel ch, String frame) {
        if (session.state() == LiveSyncSession.State.CLOSED) {
            return;
        }
        SyncMessage msg;
        try {
            msg = json.readValue(frame, SyncMessage.class);
        } catch (JsonProcessingException e) {
            log.fine(() -> "closing live-sync connection on unreadable frame: " + e.getOriginalMessage());
            IoUtils.safeClose(ch);
            return;
        }

        SyncReply reply = session.onMessage(msg);
        try {
            WebSockets.sendText(json.writeValueAsString(reply), ch, CLOSE_ON_ERROR);
        } catch (JsonProcessingException e) {
            log.log(Level.WARNING, "cannot serialize live-sync reply", e);
            IoUtils.safeClose(ch);
        }
    }

    private static void dispatch(OrderedDispatcher dispatcher, WebSocketChannel ch, Runnable task) {
        try {
            dispatcher.execute(task);
        } catch (RejectedExecutionException e) {
            log.warning("worker pool rejected live-sync work; closing connection");
            IoUtils.safeClose(ch);
        }
    }

    private static final WebSocketCallback<Void> CLOSE_ON_ERROR = new WebSocketCallback<>() {
        @Override
        public void complete(WebSocketChannel channel, Void context) {
        }

        @Override
        public void onError(WebSocketChannel channel, Void context, Throwable throwable) {
            log.fine(() -> "live-sync write failed: " + throwable.getMessage());
            IoUtils.safeClose(channel);
        }
    };
}
