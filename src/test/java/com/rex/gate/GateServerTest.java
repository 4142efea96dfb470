package com.rex.gate;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.rex.gate.auth.FileCredentialStore;
import com.rex.gate.websocket.HubMessage;
import okhttp3.*;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.mockito.ArgumentCaptor;

import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class GateServerTest {

    private static final MediaType FORM = MediaType.get("application/x-www-form-urlencoded");

    @Rule
    public TemporaryFolder mFolder = new TemporaryFolder();

    private final Gson mGson = new Gson();
    private final OkHttpClient mClient = new OkHttpClient.Builder()
            .followRedirects(false)
            .build();
    private GateConfig mConfig;
    private GateServer mServer;

    @Before
    public void setUp() throws Exception {
        mConfig = new GateConfig.Builder()
                .setMode(GateConfig.MODE_GATE)
                .setBindAddress("127.0.0.1")
                .setHttpPort(0)
                .setWsPort(0)
                .setEventPort(0)
                .setAuthFile(mFolder.getRoot().toPath().resolve("auth.json").toString())
                .setWebRoot(mFolder.getRoot().toString())
                .setBindRetries(1, 0)
                .build();
    }

    @After
    public void tearDown() {
        if (mServer != null) {
            mServer.stop();
        }
    }

    private String http(String path) {
        return "http://127.0.0.1:" + mServer.httpPort() + path;
    }

    private Response post(String path, String form, String cookie) throws Exception {
        Request.Builder builder = new Request.Builder()
                .url(http(path))
                .post(RequestBody.create(form, FORM));
        if (cookie != null) {
            builder.header("Cookie", cookie);
        }
        return mClient.newCall(builder.build()).execute();
    }

    private Response get(String path, String cookie) throws Exception {
        Request.Builder builder = new Request.Builder().url(http(path));
        if (cookie != null) {
            builder.header("Cookie", cookie);
        }
        return mClient.newCall(builder.build()).execute();
    }

    private void sendEvent(String payload) throws Exception {
        try (Socket socket = new Socket(InetAddress.getLoopbackAddress(), mServer.eventPort())) {
            OutputStream os = socket.getOutputStream();
            os.write(payload.getBytes(StandardCharsets.UTF_8));
            os.flush();
        }
    }

    @Test
    public void testLoginAndBroadcast() throws Exception {
        mServer = new GateServer(mConfig, new FileCredentialStore(mFolder.getRoot().toPath().resolve("auth.json"))).start();

        try (Response response = post("/setup", "username=admin&password=secret", null)) {
            assertEquals(302, response.code());
            assertEquals("/login", response.header("Location"));
        }

        String cookie;
        try (Response response = post("/login", "username=admin&password=secret", null)) {
            assertEquals(302, response.code());
            assertEquals("/", response.header("Location"));
            String setCookie = response.header("Set-Cookie");
            assertNotNull(setCookie);
            cookie = setCookie.substring(0, setCookie.indexOf(';'));
        }

        String token;
        try (Response response = get("/ws_token", cookie)) {
            assertEquals(200, response.code());
            JsonObject json = mGson.fromJson(response.body().string(), JsonObject.class);
            token = json.get("token").getAsString();
        }
        assertEquals(cookie, "goodgym_session=" + token);

        WebSocketListener listener = mock(WebSocketListener.class);
        WebSocket ws = mClient.newWebSocket(new Request.Builder()
                .url("ws://127.0.0.1:" + mServer.wsPort() + "/?token=" + token)
                .build(), listener);
        ArgumentCaptor<String> messages = ArgumentCaptor.forClass(String.class);
        verify(listener, timeout(Duration.ofSeconds(5).toMillis())).onMessage(eq(ws), messages.capture());
        assertEquals("{\"type\":\"connected\",\"message\":\"ok\"}", messages.getValue());

        sendEvent("{\"type\":\"play_audio\",\"sound\":\"count\",\"count\":7}");
        verify(listener, timeout(Duration.ofSeconds(5).toMillis()).times(2)).onMessage(eq(ws), messages.capture());
        HubMessage event = mGson.fromJson(messages.getValue(), HubMessage.class);
        assertEquals(HubMessage.TYPE_PLAY_AUDIO, event.type);
        assertEquals(HubMessage.SOUND_COUNT, event.sound);
        assertEquals(Integer.valueOf(7), event.count);

        ws.close(1000, null);
    }

    @Test
    public void testUnauthorizedWebsocket() throws Exception {
        mServer = new GateServer(mConfig, new FileCredentialStore(mFolder.getRoot().toPath().resolve("auth.json"))).start();

        WebSocketListener listener = mock(WebSocketListener.class);
        WebSocket ws = mClient.newWebSocket(new Request.Builder()
                .url("ws://127.0.0.1:" + mServer.wsPort() + "/?token=bogus")
                .build(), listener);
        verify(listener, timeout(Duration.ofSeconds(5).toMillis())).onClosing(eq(ws), eq(4401), eq("Unauthorized"));
        verify(listener, never()).onMessage(any(WebSocket.class), anyString());
        assertEquals(0, mServer.hub().size());
    }

    @Test
    public void testWrongWebsocketPath() throws Exception {
        mServer = new GateServer(mConfig, new FileCredentialStore(mFolder.getRoot().toPath().resolve("auth.json"))).start();

        Request request = new Request.Builder()
                .url("http://127.0.0.1:" + mServer.wsPort() + "/other")
                .build();
        try (Response response = mClient.newCall(request).execute()) {
            assertEquals(404, response.code());
        }
    }

    @Test
    public void testPortInUse() throws Exception {
        try (ServerSocket busy = new ServerSocket(0, 1, InetAddress.getByName("127.0.0.1"))) {
            GateConfig config = new GateConfig.Builder(mConfig)
                    .setHttpPort(busy.getLocalPort())
                    .build();
            GateServer server = new GateServer(config, new FileCredentialStore(mFolder.getRoot().toPath().resolve("auth.json")));
            try {
                server.start();
                fail("Bind should fail");
            } catch (GateStartException ex) {
                assertTrue(ex.getMessage().contains("http"));
            } finally {
                server.stop();
            }
        }
    }
}
