package com.jasmin.webloghunter.constants;

public class Constants {
    public static final String BROWSER = "browser";
    public static final String BOT = "bot";

    public static final String FORMAT_MARKDOWN = "md";
    public static final String FORMAT_JSON = "json";
    public static final String FORMAT_HTML = "html";
    public static final String FORMAT_ALL = "all";

    public static final int TOP_PATHS_LIMIT = 10;
    public static final int ABNORMAL_EXAMPLES_LIMIT = 8;
    public static final int ENDPOINT_EXAMPLES_LIMIT = 5;
    public static final int PAYLOAD_SIGNATURE_LENGTH = 200;

    private Constants() {
    }
}
