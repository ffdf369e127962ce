package com.gembridge.service.credential;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gembridge.exception.CredentialLoadException;
import com.gembridge.model.CredentialRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Parses the credential JSON shapes written by different tooling versions into one
 * {@link CredentialRecord}, and writes records back in the canonical shape.
 */
@Slf4j
@Component
public class CredentialNormalizer {

    /**
     * Canonical credential fields with their accepted source names, most preferred first.
     * The first name is the one written back.
     */
    enum Field {
        ACCESS_TOKEN("token", "access_token"),
        REFRESH_TOKEN("refresh_token"),
        SCOPES("scopes", "scope"),
        EXPIRY("expiry"),
        PROJECT_ID("project_id"),
        CLIENT_ID("client_id"),
        CLIENT_SECRET("client_secret"),
        TOKEN_URI("token_uri");

        private final List<String> names;

        Field(String... names) {
            this.names = List.of(names);
        }

        String canonicalName() {
            return names.get(0);
        }

        List<String> names() {
            return names;
        }
    }

    /**
     * Expiry formats in the order they are tried. Values containing a space
     * between date and time are rewritten to use 'T' first.
     */
    private static final List<Function<String, Instant>> EXPIRY_PARSERS = List.of(
            Instant::parse,
            value -> OffsetDateTime.parse(value).toInstant(),
            // Naive timestamps are written in UTC
            value -> LocalDateTime.parse(value).toInstant(ZoneOffset.UTC),
            CredentialNormalizer::parseEpoch
    );

    // Larger values are epoch milliseconds rather than seconds
    private static final long EPOCH_MILLIS_THRESHOLD = 100_000_000_000L;

    private static final DateTimeFormatter EXPIRY_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;

    public CredentialNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Normalize raw stored JSON into a record.
     *
     * @param identity storage handle of the JSON
     * @param json     raw file content
     * @return canonical record
     * @throws CredentialLoadException if the content is not a JSON object
     */
    public CredentialRecord normalize(String identity, String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new CredentialLoadException(identity, "invalid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new CredentialLoadException(identity, "expected a JSON object");
        }

        return CredentialRecord.builder()
                .identity(identity)
                .accessToken(text(root, Field.ACCESS_TOKEN).orElse(null))
                .refreshToken(text(root, Field.REFRESH_TOKEN).orElse(null))
                .projectId(text(root, Field.PROJECT_ID).orElse(null))
                .clientId(text(root, Field.CLIENT_ID).orElse(null))
                .clientSecret(text(root, Field.CLIENT_SECRET).orElse(null))
                .tokenUri(text(root, Field.TOKEN_URI).orElse(null))
                .scopes(scopes(root))
                .expiry(expiry(identity, root))
                .build();
    }

    /**
     * Serialize a record in the canonical shape. Fields of {@code previousJson} that
     * this class does not model are kept; alias spellings are dropped.
     */
    public String serialize(CredentialRecord record, String previousJson) {
        ObjectNode node = previousObject(previousJson);
        for (Field field : Field.values()) {
            field.names().forEach(node::remove);
        }

        putIfPresent(node, Field.ACCESS_TOKEN, record.getAccessToken());
        putIfPresent(node, Field.REFRESH_TOKEN, record.getRefreshToken());
        putIfPresent(node, Field.TOKEN_URI, record.getTokenUri());
        putIfPresent(node, Field.CLIENT_ID, record.getClientId());
        putIfPresent(node, Field.CLIENT_SECRET, record.getClientSecret());

        ArrayNode scopes = node.putArray(Field.SCOPES.canonicalName());
        record.getScopes().forEach(scopes::add);

        if (record.getExpiry() != null) {
            node.put(Field.EXPIRY.canonicalName(), formatExpiry(record.getExpiry()));
        }
        putIfPresent(node, Field.PROJECT_ID, record.getProjectId());

        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize credential " + record.getIdentity(), e);
        }
    }

    /**
     * Canonical UTC expiry string, second precision with a 'Z' suffix.
     */
    public static String formatExpiry(Instant expiry) {
        return EXPIRY_FORMAT.format(expiry.truncatedTo(ChronoUnit.SECONDS));
    }

    /**
     * Parse an expiry value in any accepted format.
     *
     * @return the instant, or empty when no format matches
     */
    static Optional<Instant> parseExpiry(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim().replaceFirst("^(\\d{4}-\\d{2}-\\d{2}) ", "$1T");
        for (Function<String, Instant> parser : EXPIRY_PARSERS) {
            try {
                return Optional.of(parser.apply(value));
            } catch (DateTimeException | NumberFormatException e) {
                log.trace("Expiry '{}' rejected by parser: {}", value, e.getMessage());
            }
        }
        return Optional.empty();
    }

    private static Instant parseEpoch(String value) {
        long epoch = new BigDecimal(value).longValue();
        return epoch >= EPOCH_MILLIS_THRESHOLD ? Instant.ofEpochMilli(epoch) : Instant.ofEpochSecond(epoch);
    }

    private Instant expiry(String identity, JsonNode root) {
        Optional<JsonNode> value = first(root, Field.EXPIRY);
        if (value.isEmpty()) {
            return Instant.EPOCH;
        }
        Optional<Instant> parsed = parseExpiry(value.get().asText());
        if (parsed.isEmpty()) {
            log.warn("Unrecognized expiry '{}' in credential {}, treating token as expired",
                    value.get().asText(), identity);
        }
        return parsed.orElse(Instant.EPOCH);
    }

    private Set<String> scopes(JsonNode root) {
        Set<String> scopes = new LinkedHashSet<>();
        first(root, Field.SCOPES).ifPresent(value -> {
            if (value.isArray()) {
                value.forEach(scope -> scopes.add(scope.asText()));
            } else {
                Arrays.stream(value.asText().trim().split("\\s+"))
                        .filter(scope -> !scope.isEmpty())
                        .forEach(scopes::add);
            }
        });
        return Collections.unmodifiableSet(scopes);
    }

    private Optional<String> text(JsonNode root, Field field) {
        return first(root, field)
                .map(JsonNode::asText)
                .filter(value -> !value.isBlank());
    }

    private Optional<JsonNode> first(JsonNode root, Field field) {
        for (String name : field.names()) {
            JsonNode value = root.get(name);
            if (value != null && !value.isNull()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    private ObjectNode previousObject(String previousJson) {
        if (previousJson != null) {
            try {
                JsonNode previous = objectMapper.readTree(previousJson);
                if (previous != null && previous.isObject()) {
                    return (ObjectNode) previous;
                }
            } catch (JsonProcessingException e) {
                log.debug("Previous credential content is not JSON, writing a fresh document");
            }
        }
        return objectMapper.createObjectNode();
    }

    private static void putIfPresent(ObjectNode node, Field field, String value) {
        if (value != null) {
            node.put(field.canonicalName(), value);
        }
    }
}
