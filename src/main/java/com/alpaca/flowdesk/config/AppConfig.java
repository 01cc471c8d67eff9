package com.alpaca.flowdesk.config;

import com.alpaca.flowdesk.exception.ConfigurationException;
import io.github.cdimascio.dotenv.Dotenv;

/** Credentials and endpoints, read from the environment or a local .env file. */
public class AppConfig {
    private final Dotenv env;

    public AppConfig() { this(Dotenv.configure().ignoreIfMissing().load()); }

    public AppConfig(Dotenv env) { this.env = env; }

    public String alpacaKey()        { return env.get("APCA_API_KEY_ID"); }
    public String alpacaSecret()     { return env.get("APCA_API_SECRET_KEY"); }
    public String alpacaBaseUrl()    { return env.get("APCA_API_BASE_URL", "https://paper-api.alpaca.markets"); }
    public String alpacaDataUrl()    { return env.get("APCA_DATA_URL", "https://data.alpaca.markets"); }
    public String alpacaDataFeed()   { return env.get("APCA_DATA_FEED", "iex"); }
    public String telegramToken()    { return env.get("TELEGRAM_BOT_TOKEN", ""); }
    public String telegramChatId()   { return env.get("TELEGRAM_CHAT_ID", ""); }

    /** wss endpoint of the trade_updates stream that matches the REST base url. */
    public String alpacaStreamUrl() {
        String base = alpacaBaseUrl().trim().replaceAll("/+$", "");
        if (base.startsWith("https://")) return "wss://" + base.substring("https://".length()) + "/stream";
        if (base.startsWith("http://"))  return "ws://" + base.substring("http://".length()) + "/stream";
        return base + "/stream";
    }

    public boolean isPaper() { return alpacaBaseUrl().toLowerCase().contains("paper"); }

    public void requireAlpacaCredentials() {
        if (isBlank(alpacaKey()))    throw new ConfigurationException("Missing env var: APCA_API_KEY_ID");
        if (isBlank(alpacaSecret())) throw new ConfigurationException("Missing env var: APCA_API_SECRET_KEY");
    }

    private static boolean isBlank(String s) { return s == null || s.isBlank(); }
}
