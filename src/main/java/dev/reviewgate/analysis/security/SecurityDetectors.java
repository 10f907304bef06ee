package dev.reviewgate.analysis.security;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered table of line detectors. Order determines message order within a finding.
 */
final class SecurityDetectors {

    private static final String Q = "[\"']";
    private static final String NQ = "[^\"']";

    static final List<String> LOGGING_KEYWORDS = List.of(
            "console.writeline", "console.write", "console.log",
            "log.info", "log.debug", "log.warn", "log.error", "log.trace",
            "logger.info", "logger.debug", "logger.warn", "logger.error", "logger.trace",
            "system.out.print", "system.err.print",
            "debug.print", "trace.write",
            "print(", "println(",
            "response.write", "response.send");

    static final List<String> SENSITIVE_KEYWORDS = List.of(
            "password", "passwd", "pwd", "secret", "token", "key",
            "credential", "auth", "connection", "connectionstring");

    private static final List<String> SECRET_WORDS = List.of("password", "secret", "key", "token");

    private static final Pattern EXPOSURE_METHOD = Pattern.compile(
            "\\b((?:reveal|expose|leak|dump)\\w*(password|passwd|secret|credential)\\w*)\\s*\\(",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern ACCESS_MODIFIER = Pattern.compile(
            "\\b(public|private|protected|internal)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern MUTABLE_CREDENTIAL_FIELD = Pattern.compile(
            "\\bpublic\\s+(?:static\\s+)?(?!final\\b|const\\b|readonly\\b)[\\w<>\\[\\]?]+\\s+"
                    + "\\w*(password|passwd|secret|apikey|api_key|token)\\w*\\s*(;|=|\\{\\s*get;\\s*set;)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern CONFIG_VALUE = Pattern.compile(Q + "\\s*[a-zA-Z0-9+/=]{20,}\\s*" + Q);
    private static final Pattern BASE64_VALUE = Pattern.compile(Q + "[A-Za-z0-9+/]{40,}={0,2}" + Q);
    private static final Pattern ENVIRONMENT_READ = Pattern.compile("environment\\.(get|getenv|getenvironmentvariable)");
    private static final Pattern SQL_CREDENTIAL = Pattern.compile("(password|secret)\\s*=");

    static final List<LineDetector> ORDERED = List.of(
            SecurityDetectors::exposureMethod,
            SecurityDetectors::passwordReturn,
            SecurityDetectors::sensitiveLogging,
            SecurityDetectors::toStringExposure,
            patternGroup("PASSWORD EXPOSURE",
                    rule("\\b(reveal|get|show|display|expose|return|fetch|retrieve).*password\\b", "Method exposes password"),
                    rule("\\bpassword.*\\.(get|show|reveal|display|expose|return|value|text)\\b", "Property exposes password"),
                    rule("\\b(public|export|global).*password\\s*[=:]", "Public password assignment"),
                    rule("password\\s*[:=]\\s*" + Q + NQ + "{3,}" + Q, "Hardcoded password value"),
                    rule("(http|api|url|uri).*[?&]password=", "Password in URL parameter"),
                    rule("password\\s*[!=]==?\\s*" + Q + NQ + "+" + Q, "Password comparison with literal"),
                    rule(Q + "\\s*password\\s*" + Q + "\\s*:\\s*" + Q + NQ + "+" + Q, "Password in JSON/object structure"),
                    rule("\\bpassword\\s*\\+\\s*", "Password concatenation (potential exposure)"),
                    rule("\\$\\{?password\\}?", "Password variable interpolation")),
            patternGroup("CONNECTION STRING LEAK",
                    rule("\\b(connection[_-]?string|connectionstring)\\s*[:=]\\s*" + Q + NQ + "*password" + NQ + "*" + Q,
                            "Connection string with embedded password"),
                    rule("\\b(data\\s+source|server|database)\\s*=.*password\\s*=", "Database connection with password"),
                    rule("\\b(mongodb|mysql|postgresql|mssql|oracle)://[^\\s]*:[^\\s]*@", "Database URL with credentials"),
                    rule("\\b(trusted_connection|integrated\\s+security)\\s*=\\s*(false|no).*password",
                            "Non-integrated auth with password"),
                    rule("\\b(uid|user\\s+id)\\s*=.*pwd\\s*=", "Database connection with user/password"),
                    rule("\\b(provider|driver)\\s*=.*password\\s*=", "Data provider connection with password")),
            patternGroup("TOKEN LEAK",
                    rule(literal("(api[_-]?key|apikey)", "[a-zA-Z0-9]{16,}"), "Hardcoded API key"),
                    rule(literal("(secret[_-]?key|secretkey)", "[a-zA-Z0-9]{16,}"), "Hardcoded secret key"),
                    rule(literal("(access[_-]?token|accesstoken)", "[a-zA-Z0-9]{16,}"), "Hardcoded access token"),
                    rule(literal("(bearer[_-]?token|bearertoken)", "[a-zA-Z0-9]{16,}"), "Hardcoded bearer token"),
                    rule(literal("(refresh[_-]?token|refreshtoken)", "[a-zA-Z0-9]{16,}"), "Hardcoded refresh token"),
                    rule(literal("(private[_-]?key|privatekey)", "[a-zA-Z0-9+/=]{32,}"), "Hardcoded private key"),
                    rule(literal("(client[_-]?secret|clientsecret)", "[a-zA-Z0-9]{16,}"), "Hardcoded client secret"),
                    rule(literal("(oauth[_-]?token|oauthtoken)", "[a-zA-Z0-9]{16,}"), "Hardcoded OAuth token"),
                    rule(literal("authorization", "bearer\\s+[a-zA-Z0-9]{16,}"), "Authorization header with token"),
                    rule(literal("(jwt|token)", "ey[a-zA-Z0-9+/=]{16,}"), "JWT token hardcoded")),
            patternGroup("CLOUD SECRET LEAK",
                    rule(literal("(aws[_-]?access[_-]?key[_-]?id)", "AKIA[0-9A-Z]{16}"), "AWS Access Key ID"),
                    rule(literal("(aws[_-]?secret[_-]?access[_-]?key)", "[a-zA-Z0-9+/]{40}"), "AWS Secret Access Key"),
                    rule(literal("(azure[_-]?client[_-]?secret)", "[a-zA-Z0-9~._-]{34,}"), "Azure Client Secret"),
                    rule(literal("(gcp[_-]?service[_-]?account[_-]?key)", "[a-zA-Z0-9+/=]{500,}"), "GCP Service Account Key")),
            patternGroup("CERTIFICATE LEAK",
                    rule("-----BEGIN\\s+(PRIVATE\\s+KEY|RSA\\s+PRIVATE\\s+KEY|CERTIFICATE)", "Private key or certificate in code"),
                    rule(literal("(ssl[_-]?cert|certificate)", NQ + "{50,}"), "SSL certificate hardcoded"),
                    rule(literal("(thumbprint|fingerprint)", "[a-fA-F0-9]{40,}"), "Certificate thumbprint")),
            SecurityDetectors::mutableCredentialField,
            SecurityDetectors::configurationLeak,
            SecurityDetectors::encodedSecret,
            SecurityDetectors::environmentLeak,
            SecurityDetectors::sqlCredential);

    private SecurityDetectors() {}

    static boolean isLoggingStatement(String lower) {
        return containsAny(lower, LOGGING_KEYWORDS);
    }

    static boolean containsSensitiveData(String lower) {
        return containsAny(lower, SENSITIVE_KEYWORDS);
    }

    private static List<String> exposureMethod(LineContext ctx) {
        Matcher m = EXPOSURE_METHOD.matcher(ctx.line());
        if (!m.find() || !ACCESS_MODIFIER.matcher(ctx.line()).find()) return List.of();
        return List.of("CRITICAL: " + m.group(1) + " method exposes sensitive "
                + m.group(2).toLowerCase(Locale.ROOT) + " information");
    }

    private static List<String> passwordReturn(LineContext ctx) {
        if (ctx.trimmed().startsWith("return") && ctx.lower().contains("password"))
            return List.of("CRITICAL: Method returns password value directly");
        return List.of();
    }

    private static List<String> sensitiveLogging(LineContext ctx) {
        String lower = ctx.lower();
        if (isLoggingStatement(lower) && containsSensitiveData(lower))
            return List.of("CRITICAL: Sensitive data logged - passwords/secrets should never be logged");
        return List.of();
    }

    private static List<String> toStringExposure(LineContext ctx) {
        String lower = ctx.lower();
        if (!lower.contains("tostring") || !(lower.contains("override") || lower.contains("public")))
            return List.of();
        for (String next : ctx.following(10)) {
            if (next.toLowerCase(Locale.ROOT).contains("password"))
                return List.of("CRITICAL: ToString method exposes password information");
        }
        return List.of();
    }

    private static List<String> mutableCredentialField(LineContext ctx) {
        if (MUTABLE_CREDENTIAL_FIELD.matcher(ctx.line()).find())
            return List.of("CREDENTIAL FIELD: Public mutable credential field");
        return List.of();
    }

    private static List<String> configurationLeak(LineContext ctx) {
        if (ctx.pathEndsWith(".config", ".xml", ".json", ".yaml", ".yml", ".properties", ".env")
                && CONFIG_VALUE.matcher(ctx.line()).find()
                && containsAny(ctx.lower(), SECRET_WORDS))
            return List.of("CONFIGURATION LEAK: Sensitive value in configuration file");
        return List.of();
    }

    private static List<String> encodedSecret(LineContext ctx) {
        if (isCodeFile(ctx)
                && BASE64_VALUE.matcher(ctx.line()).find()
                && containsAny(ctx.lower(), SECRET_WORDS))
            return List.of("ENCODED SECRET: Base64 encoded secret detected");
        return List.of();
    }

    private static List<String> environmentLeak(LineContext ctx) {
        String lower = ctx.lower();
        if (isCodeFile(ctx)
                && ENVIRONMENT_READ.matcher(lower).find()
                && containsAny(lower, SECRET_WORDS)
                && isLoggingStatement(lower))
            return List.of("ENVIRONMENT LEAK: Environment variable with secret being logged");
        return List.of();
    }

    private static List<String> sqlCredential(LineContext ctx) {
        if (ctx.pathEndsWith(".sql", ".ddl") && SQL_CREDENTIAL.matcher(ctx.lower()).find())
            return List.of("SQL CREDENTIAL: Password or secret in SQL file");
        return List.of();
    }

    private static boolean isCodeFile(LineContext ctx) {
        return ctx.pathEndsWith(".cs", ".java", ".js", ".ts", ".py", ".php");
    }

    private static boolean containsAny(String lower, List<String> keywords) {
        for (String keyword : keywords) {
            if (lower.contains(keyword)) return true;
        }
        return false;
    }

    /** {@code name = "value"} or {@code name: 'value'} with the given value shape. */
    private static String literal(String name, String value) {
        return "\\b" + name + "\\s*[:=]\\s*" + Q + value + Q;
    }

    private static Rule rule(String regex, String description) {
        return new Rule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), description);
    }

    private static LineDetector patternGroup(String label, Rule... rules) {
        List<Rule> table = List.of(rules);
        return ctx -> {
            List<String> hits = new ArrayList<>();
            for (Rule r : table) {
                if (r.pattern().matcher(ctx.line()).find()) hits.add(label + ": " + r.description());
            }
            return hits;
        };
    }

    private record Rule(Pattern pattern, String description) {}
}
