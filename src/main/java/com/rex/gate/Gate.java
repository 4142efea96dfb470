package com.rex.gate;

import com.rex.gate.auth.FileCredentialStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Access gate entry point
 */
public class Gate {

    private static final Logger sLogger = LoggerFactory.getLogger(Gate.class);

    static final String ENV_CONFIG = "GATE_CONF";

    private GateServer mGateServer;
    private ProxyServer mProxyServer;

    public Gate start(GateConfig config) {
        sLogger.info("Start {}", config);
        String mode = checkMode(config.mode);
        FileCredentialStore store = new FileCredentialStore(Paths.get(config.authFile));
        sLogger.info("Credential file {}", store.file().toAbsolutePath());

        if (GateConfig.MODE_GATE.equalsIgnoreCase(mode) || GateConfig.MODE_ALL.equalsIgnoreCase(mode)) {
            mGateServer = new GateServer(config, store);
            mGateServer.start();
        }
        if (GateConfig.MODE_PROXY.equalsIgnoreCase(mode) || GateConfig.MODE_ALL.equalsIgnoreCase(mode)) {
            mProxyServer = new ProxyServer(config, store);
            mProxyServer.start();
        }
        return this;
    }

    public GateServer gateServer() {
        return mGateServer;
    }

    public ProxyServer proxyServer() {
        return mProxyServer;
    }

    public Gate stop() {
        if (mProxyServer != null) {
            mProxyServer.stop();
            mProxyServer = null;
        }
        if (mGateServer != null) {
            mGateServer.stop();
            mGateServer = null;
        }
        return this;
    }

    /**
     * @return the effective mode, {@code all} when unset
     * @throws IllegalArgumentException for anything but gate, proxy or all
     */
    static String checkMode(String mode) {
        if (mode == null) {
            return GateConfig.MODE_ALL;
        }
        if (GateConfig.MODE_GATE.equalsIgnoreCase(mode)
                || GateConfig.MODE_PROXY.equalsIgnoreCase(mode)
                || GateConfig.MODE_ALL.equalsIgnoreCase(mode)) {
            return mode;
        }
        throw new IllegalArgumentException("Unknown mode " + mode);
    }

    static GateConfig loadConfig(String configFile) throws IOException {
        Properties properties = new Properties();
        if (configFile != null) {
            try (InputStream is = new FileInputStream(configFile)) {
                properties.load(is);
            }
        }
        GateConfig config = new GateConfig.Builder(properties)
                .environment(System.getenv())
                .build();
        checkMode(config.mode);
        return config;
    }

    public static void main(String[] args) {
        String configFile = System.getProperty(ENV_CONFIG);
        if (System.getenv().containsKey(ENV_CONFIG)) {
            configFile = System.getenv(ENV_CONFIG);
        }

        int idx = 0;
        while (idx < args.length) {
            String key = args[idx++];
            if (("-c".equals(key) || "--config".equals(key)) && idx < args.length) {
                configFile = args[idx++];
            }
            if ("-h".equals(key) || "--help".equals(key)) {
                printHelp();
                return;
            }
        }

        GateConfig config;
        try {
            config = loadConfig(configFile);
        } catch (IOException | IllegalArgumentException ex) {
            sLogger.warn("Failed to load config file " + configFile + "\n", ex);
            printHelp();
            System.exit(2);
            return;
        }

        final Gate gate = new Gate();
        try {
            gate.start(config);
        } catch (GateStartException ex) {
            sLogger.error("Failed to start\n", ex);
            gate.stop();
            System.exit(1);
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(gate::stop, "Gate-Shutdown"));
    }

    private static void printHelp() {
        System.out.println("Usage: Gate [options]");
        System.out.println("    -c | --config   Configuration file");
        System.out.println("    -h | --help     Help page");
    }
}
