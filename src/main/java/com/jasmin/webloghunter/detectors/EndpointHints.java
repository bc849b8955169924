package com.jasmin.webloghunter.detectors;

import java.util.regex.Pattern;

/**
 * Path vocabularies used to classify endpoints and requests.
 */
public final class EndpointHints {

    public static final Pattern IDENTITY = Pattern.compile(
            "(whoami|profile|account|user|users|customer|customers|admin|member)", Pattern.CASE_INSENSITIVE);

    public static final Pattern LOGIN = Pattern.compile(
            "(login|signin|auth|token|session|oauth|sso|authenticate)", Pattern.CASE_INSENSITIVE);

    public static final Pattern API = Pattern.compile(
            "(/api/|/rest/|/graphql|/v\\d+/|\\.json|\\.xml)", Pattern.CASE_INSENSITIVE);

    public static final Pattern SENSITIVE = Pattern.compile(
            "(/export|/download|/backup|/dump|/database|/admin/users|/api/users|\\.sql|\\.db|\\.bak)",
            Pattern.CASE_INSENSITIVE);

    public static final Pattern SESSION_PARAMS = Pattern.compile(
            "(session|sessionid|sid|jsessionid|phpsessid)", Pattern.CASE_INSENSITIVE);

    public static final Pattern BOT_USER_AGENTS = Pattern.compile(
            "(bot|crawler|spider|scraper|slurp|googlebot|bingbot|"
                    + "yandexbot|baiduspider|facebookexternalhit|twitterbot)", Pattern.CASE_INSENSITIVE);

    private EndpointHints() {
    }

    public static boolean isLoginPath(String path) {
        return path != null && LOGIN.matcher(path).find();
    }

    public static boolean isIdentityPath(String path) {
        return path != null && IDENTITY.matcher(path).find();
    }
}
