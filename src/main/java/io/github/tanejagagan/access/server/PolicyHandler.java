package io.github.tanejagagan.access.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import io.github.tanejagagan.access.common.evaluation.EvaluationContext;
import io.github.tanejagagan.access.common.evaluation.RuleEvaluator;
import io.github.tanejagagan.access.common.policy.AccessLevel;
import io.github.tanejagagan.access.common.policy.PolicyDocument;
import io.github.tanejagagan.access.common.policy.PolicyException;
import io.github.tanejagagan.access.common.policy.RowRuleField;
import io.github.tanejagagan.access.common.schema.SchemaDiscovery;
import io.github.tanejagagan.access.common.serde.PolicySerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.github.tanejagagan.access.server.Routers.*;

/**
 * Serves {@code /policies/{id}} and its {@code schema}, {@code edits} and
 * {@code evaluate} sub resources.
 */
public class PolicyHandler implements HttpHandler {
    public static final String CONTEXT = "/policies";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Logger logger = LoggerFactory.getLogger(PolicyHandler.class);

    private final PolicyStore store;
    private final SchemaDiscovery schemaDiscovery;
    private final List<String> defaultPrincipals;

    public PolicyHandler(PolicyStore store, SchemaDiscovery schemaDiscovery, List<String> defaultPrincipals) {
        this.store = store;
        this.schemaDiscovery = schemaDiscovery;
        this.defaultPrincipals = List.copyOf(defaultPrincipals);
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        try {
            handleInternal(exchange);
        } catch (HttpException e) {
            if (e instanceof InternalErrorException) {
                logger.atError().setCause(e).log("Error");
            }
            send(exchange, e.errorCode, ContentTypes.TEXT_PLAIN, e.getMessage().getBytes(StandardCharsets.UTF_8));
        }
    }

    private void handleInternal(HttpExchange exchange) throws IOException {
        var segments = pathSegments(exchange.getRequestURI());
        if (segments.isEmpty() || segments.size() > 2) {
            throw new NotFoundException("No such resource: " + exchange.getRequestURI().getPath());
        }
        var id = segments.get(0);
        var action = segments.size() == 2 ? segments.get(1) : null;
        try {
            if (action == null) {
                if (get.test(exchange)) {
                    sendPolicy(exchange, store.getOrThrow(id));
                } else if (put.test(exchange)) {
                    requireJson(exchange);
                    upload(exchange, id);
                } else if (delete.test(exchange)) {
                    if (!store.remove(id)) {
                        throw new NoSuchPolicyException(id);
                    }
                    send(exchange, 204, null, null);
                } else {
                    methodNotAllowed(exchange, "GET, PUT, DELETE");
                }
                return;
            }
            if (!post.test(exchange)) {
                methodNotAllowed(exchange, "POST");
                return;
            }
            switch (action) {
                case "schema" -> initialize(exchange, id);
                case "edits" -> {
                    requireJson(exchange);
                    edit(exchange, id);
                }
                case "evaluate" -> {
                    requireJson(exchange);
                    evaluate(exchange, id);
                }
                default -> throw new NotFoundException("No such resource: " + exchange.getRequestURI().getPath());
            }
        } catch (PolicyException e) {
            throw toHttpException(e);
        } catch (NoSuchPolicyException e) {
            throw new NotFoundException(e.getMessage());
        } catch (JsonProcessingException e) {
            throw new BadRequestException("Malformed request: " + e.getOriginalMessage());
        } catch (HttpException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InternalErrorException(String.valueOf(e.getMessage()), e);
        }
    }

    private void upload(HttpExchange exchange, String id) throws IOException, PolicyException {
        PolicyDocument document;
        try (InputStream in = exchange.getRequestBody()) {
            document = PolicySerializer.deserialize(in.readAllBytes());
        } catch (PolicyException e) {
            logger.warn("Rejected policy upload for {}: {}", id, e.getMessage());
            throw e;
        }
        if (!id.equals(document.dataSourceIdentifier())) {
            throw new BadRequestException(String.format("dataSourceIdentifier %s does not match %s",
                    document.dataSourceIdentifier(), id));
        }
        store.put(document);
        sendPolicy(exchange, document);
    }

    private void initialize(HttpExchange exchange, String id) throws IOException, PolicyException {
        List<String> columns;
        try (InputStream in = exchange.getRequestBody()) {
            columns = schemaDiscovery.discoverColumns(in);
        }
        var principals = getQueryParameters(exchange.getRequestURI()).getOrDefault("principal", defaultPrincipals);
        sendPolicy(exchange, store.initialize(id, columns, principals));
    }

    private void edit(HttpExchange exchange, String id) throws IOException, PolicyException, NoSuchPolicyException {
        EditRequest request;
        try (InputStream in = exchange.getRequestBody()) {
            request = MAPPER.readValue(in, EditRequest.class);
        }
        if (request.op() == null) {
            throw new BadRequestException("Missing op");
        }
        var result = store.edit(id, document -> {
            apply(request, document);
            return document.copy();
        });
        sendPolicy(exchange, result);
    }

    static void apply(EditRequest request, PolicyDocument document) throws PolicyException {
        switch (request.op()) {
            case "addPrincipal" -> document.addPrincipal(request.principal());
            case "removePrincipal" -> document.removePrincipal(request.principal());
            case "renamePrincipal" -> document.renamePrincipal(request.principal(), request.newName());
            case "setColumnPermission" -> document.setColumnPermission(request.principal(), request.column(),
                    AccessLevel.parse(request.level()));
            case "addRowRule" -> document.addRowRule(request.principal());
            case "updateRowRule" -> {
                RowRuleField field;
                try {
                    field = RowRuleField.fromWireName(request.field());
                } catch (IllegalArgumentException e) {
                    throw new BadRequestException(e.getMessage());
                }
                document.updateRowRule(request.principal(), requireRuleId(request), field, request.value());
            }
            case "deleteRowRule" -> document.deleteRowRule(request.principal(), requireRuleId(request));
            default -> throw new BadRequestException("Unknown op: " + request.op());
        }
    }

    private static long requireRuleId(EditRequest request) {
        if (request.ruleId() == null) {
            throw new BadRequestException("Missing ruleId");
        }
        return request.ruleId();
    }

    private void evaluate(HttpExchange exchange, String id) throws IOException, PolicyException, NoSuchPolicyException {
        EvaluateRequest request;
        try (InputStream in = exchange.getRequestBody()) {
            request = MAPPER.readValue(in, EvaluateRequest.class);
        }
        if (request.principal() == null || request.identity() == null) {
            throw new BadRequestException("principal and identity are required");
        }
        var document = store.getOrThrow(id);
        var context = new EvaluationContext(request.identity(), request.attributes());
        var rows = new ArrayList<Map<String, String>>();
        if (request.rows() != null) {
            for (var row : request.rows()) {
                rows.add(toTextRow(row));
            }
        }
        var response = new EvaluateResponse(
                RuleEvaluator.visibleColumns(request.principal(), document),
                RuleEvaluator.apply(request.principal(), document, context, rows));
        send(exchange, 200, ContentTypes.APPLICATION_JSON, MAPPER.writeValueAsBytes(response));
    }

    private static Map<String, String> toTextRow(Map<String, JsonNode> row) {
        var result = new LinkedHashMap<String, String>();
        row.forEach((column, value) -> {
            if (value != null && value.isValueNode() && !value.isNull()) {
                result.put(column, value.asText());
            }
        });
        return result;
    }

    static HttpException toHttpException(PolicyException e) {
        return switch (e.getError()) {
            case UNKNOWN_PRINCIPAL, UNKNOWN_RULE -> new NotFoundException(e.getMessage());
            case DUPLICATE_PRINCIPAL -> new ConflictException(e.getMessage());
            default -> new BadRequestException(e.getMessage());
        };
    }

    private static void requireJson(HttpExchange exchange) {
        if (!contentType(ContentTypes.APPLICATION_JSON).test(exchange)) {
            throw new BadRequestException("Expected " + CONTENT_TYPE + ": " + ContentTypes.APPLICATION_JSON);
        }
    }

    private static void sendPolicy(HttpExchange exchange, PolicyDocument document) throws IOException {
        send(exchange, 200, ContentTypes.APPLICATION_JSON, PolicySerializer.serializeToBytes(document));
    }

    private static void methodNotAllowed(HttpExchange exchange, String allowed) throws IOException {
        exchange.getResponseHeaders().set("Allow", allowed);
        send(exchange, 405, null, null);
    }

    static void send(HttpExchange exchange, int status, String contentType, byte[] body) throws IOException {
        if (contentType != null) {
            exchange.getResponseHeaders().set(CONTENT_TYPE, contentType);
        }
        try (var os = exchange.getResponseBody()) {
            if (body == null || body.length == 0) {
                exchange.sendResponseHeaders(status, -1);
            } else {
                exchange.sendResponseHeaders(status, body.length);
                os.write(body);
                os.flush();
            }
        }
    }

    static List<String> pathSegments(URI uri) {
        var path = uri.getRawPath();
        var rest = path.length() > CONTEXT.length() ? path.substring(CONTEXT.length()) : "";
        var result = new ArrayList<String>();
        for (var s : rest.split("/")) {
            if (!s.isEmpty()) {
                result.add(URLDecoder.decode(s, StandardCharsets.UTF_8));
            }
        }
        return result;
    }

    public static Map<String, List<String>> getQueryParameters(URI uri) {
        Map<String, List<String>> queryParams = new HashMap<>();
        String query = uri.getRawQuery();
        if (query != null && !query.isEmpty()) {
            String[] pairs = query.split("&");
            for (String pair : pairs) {
                int idx = pair.indexOf("=");
                String key = URLDecoder.decode(idx > 0 ? pair.substring(0, idx) : pair, StandardCharsets.UTF_8);
                String value = idx > 0 && pair.length() > idx + 1 ? URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8) : "";
                queryParams.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
            }
        }
        return queryParams;
    }
}
