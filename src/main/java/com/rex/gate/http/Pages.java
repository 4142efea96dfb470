package com.rex.gate.http;

/**
 * HTML for the setup and login forms
 */
public final class Pages {

    public static final String ERROR_SETUP = "Invalid request";
    public static final String ERROR_LOGIN = "Account or password incorrect";

    private static final String STYLE =
            "body { font-family: -apple-system, BlinkMacSystemFont, \"Segoe UI\", Roboto, sans-serif; display: flex; justify-content: center; align-items: center; height: 100vh; background: #f0f2f5; margin: 0; }\n"
            + ".card { background: white; padding: 2rem; border-radius: 12px; box-shadow: 0 4px 6px -1px rgba(0,0,0,0.1); width: 100%; max-width: 320px; }\n"
            + "h2 { text-align: center; color: #1a1a1a; margin-top: 0; }\n"
            + "p { text-align: center; color: #718096; margin-bottom: 1.5rem; }\n"
            + "label { display: block; margin-bottom: 0.5rem; color: #4a5568; font-size: 0.875rem; font-weight: 500; }\n"
            + "input { width: 100%; padding: 0.75rem; margin-bottom: 1rem; border: 1px solid #e2e8f0; border-radius: 0.375rem; box-sizing: border-box; }\n"
            + "button { width: 100%; padding: 0.75rem; background: #3182ce; color: white; border: none; border-radius: 0.375rem; font-weight: 600; cursor: pointer; }\n"
            + "button:hover { background: #2c5282; }\n"
            + ".error { color: red; margin-bottom: 10px; }\n";

    private Pages() {
    }

    public static String setup(String error) {
        return page("Good-GYM Setup", "Good-GYM Setup", "Please set up your access credentials.", error,
                "/setup", "Username (default: admin)", "admin", "Set Credentials");
    }

    public static String login(String error, String username) {
        String value = (username == null || username.isEmpty()) ? "admin" : username;
        return page("Good-GYM Login", "Good-GYM Login", "Sign in to open the main page.", error,
                "/login", "Username", value, "Sign in");
    }

    private static String page(String title, String heading, String hint, String error,
                               String action, String userLabel, String userValue, String submit) {
        StringBuilder builder = new StringBuilder();
        builder.append("<!DOCTYPE html>\n<html>\n<head>\n");
        builder.append("<title>").append(escape(title)).append("</title>\n");
        builder.append("<meta charset=\"utf-8\">\n");
        builder.append("<meta name=\"viewport\" content=\"width=device-width, initial-scale=1\">\n");
        builder.append("<style>\n").append(STYLE).append("</style>\n");
        builder.append("</head>\n<body>\n<div class=\"card\">\n");
        builder.append("<h2>").append(escape(heading)).append("</h2>\n");
        builder.append("<p>").append(escape(hint)).append("</p>\n");
        if (error != null) {
            builder.append("<div class=\"error\">").append(escape(error)).append("</div>\n");
        }
        builder.append("<form method=\"POST\" action=\"").append(action).append("\">\n");
        builder.append("<label>").append(escape(userLabel)).append("</label>\n");
        builder.append("<input type=\"text\" name=\"username\" value=\"").append(escape(userValue)).append("\" required>\n");
        builder.append("<label>Password</label>\n");
        builder.append("<input type=\"password\" name=\"password\" required>\n");
        builder.append("<button type=\"submit\">").append(escape(submit)).append("</button>\n");
        builder.append("</form>\n</div>\n</body>\n</html>\n");
        return builder.toString();
    }

    static String escape(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder builder = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
            case '<': builder.append("&lt;"); break;
            case '>': builder.append("&gt;"); break;
            case '&': builder.append("&amp;"); break;
            case '"': builder.append("&quot;"); break;
            case '\'': builder.append("&#39;"); break;
            default: builder.append(c); break;
            }
        }
        return builder.toString();
    }
}
