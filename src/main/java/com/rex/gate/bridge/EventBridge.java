package com.rex.gate.bridge;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.rex.gate.websocket.BroadcastHub;
import com.rex.gate.websocket.HubMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;

/**
 * Loopback only listener for the local producer process
 *
 * One JSON object per connection, no reply, the connection is closed after reading:
 * P -> B {"type":"play_audio", "sound":"count", "count":7}
 *
 * Runs on its own blocking thread, accepted events are handed to the hub executor.
 */
public class EventBridge implements Runnable {

    private static final Logger sLogger = LoggerFactory.getLogger(EventBridge.class);

    static final int MAX_PAYLOAD = 4096;
    static final int READ_TIMEOUT_MILLIS = 2000;

    private final Gson mCodec = new Gson();
    private final BroadcastHub mHub;
    private final ServerSocket mServerSocket;
    private Thread mThread;

    /**
     * The socket is bound on the caller thread so a bind failure surfaces right away
     */
    public EventBridge(BroadcastHub hub, int port) throws IOException {
        sLogger.trace("<init> port:{}", port);
        mHub = hub;
        mServerSocket = new ServerSocket();
        mServerSocket.setReuseAddress(true);
        mServerSocket.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), port), 5);
    }

    public synchronized EventBridge start() {
        if (mThread != null) {
            sLogger.warn("already started");
            return this;
        }
        mThread = new Thread(this, "EventBridge-" + port());
        mThread.setDaemon(true);
        mThread.start();
        sLogger.info("Event bridge listening on {}", mServerSocket.getLocalSocketAddress());
        return this;
    }

    public synchronized EventBridge stop() {
        sLogger.trace("stop");
        try {
            mServerSocket.close();
        } catch (IOException ex) {
            sLogger.warn("Failed to close event bridge - {}", ex.toString());
        }
        if (mThread != null) {
            try {
                mThread.join(1000);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            mThread = null;
        }
        return this;
    }

    public int port() {
        return mServerSocket.getLocalPort();
    }

    InetAddress address() {
        return mServerSocket.getInetAddress();
    }

    @Override // Runnable
    public void run() {
        while (!mServerSocket.isClosed()) {
            try (Socket socket = mServerSocket.accept()) {
                socket.setSoTimeout(READ_TIMEOUT_MILLIS);
                String payload = read(socket.getInputStream());
                socket.close();
                handle(payload);
            } catch (SocketException ex) {
                if (mServerSocket.isClosed()) {
                    break;
                }
                sLogger.warn("Event connection failed - {}", ex.toString());
            } catch (IOException ex) {
                sLogger.warn("Event read failed - {}", ex.toString());
            } catch (RuntimeException ex) {
                sLogger.warn("Event handling failed - {}", ex.toString());
            }
        }
        sLogger.info("Event bridge stopped");
    }

    /**
     * Read until the producer closes its side, bounded by {@link #MAX_PAYLOAD} and the read timeout
     */
    static String read(InputStream is) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buf = new byte[1024];
        int len;
        try {
            while (out.size() < MAX_PAYLOAD && (len = is.read(buf, 0, Math.min(buf.length, MAX_PAYLOAD - out.size()))) != -1) {
                out.write(buf, 0, len);
            }
        } catch (SocketTimeoutException ex) {
            sLogger.debug("Producer kept the connection open, use {} bytes", out.size());
        }
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    void handle(String payload) {
        if (payload == null || payload.trim().isEmpty()) {
            return;
        }
        sLogger.debug("Event received {}", payload);

        HubMessage event;
        try {
            event = mCodec.fromJson(payload, HubMessage.class);
        } catch (JsonParseException ex) {
            sLogger.warn("Drop malformed event - {}", ex.getMessage());
            return;
        }
        if (event == null || !HubMessage.TYPE_PLAY_AUDIO.equals(event.type)) {
            sLogger.warn("Drop event with type {}", (event == null) ? null : event.type);
            return;
        }
        if (event.sound == null) {
            event.sound = HubMessage.SOUND_COUNT;
        }
        if (!HubMessage.isKnownSound(event.sound)) {
            sLogger.warn("Drop event with sound {}", event.sound);
            return;
        }
        mHub.submit(HubMessage.playAudio(event.sound, event.count));
    }
}
