package it.unimib.datai.handlerharness.common.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CommonModelTest {

    private final ObjectMapper mapper = new ObjectMapper();

    // --- Action ---

    @Test
    void action_fromName_isCaseInsensitive() {
        assertEquals(Action.CREATE, Action.fromName("create"));
        assertEquals(Action.LIST, Action.fromName(" List "));
    }

    @Test
    void action_fromName_rejectsUnknownValue() {
        InvalidActionException ex = assertThrows(InvalidActionException.class, () -> Action.fromName("PATCH"));
        assertEquals("PATCH", ex.action());
        assertTrue(ex.getMessage().contains("CREATE"));
    }

    @Test
    void action_fromName_rejectsBlank() {
        assertThrows(InvalidActionException.class, () -> Action.fromName(" "));
        assertThrows(InvalidActionException.class, () -> Action.fromName(null));
    }

    @Test
    void action_readAndListAreSynchronous() {
        assertTrue(Action.READ.isSynchronous());
        assertTrue(Action.LIST.isSynchronous());
        assertFalse(Action.CREATE.isSynchronous());
        assertFalse(Action.DELETE.isSynchronous());
    }

    // --- OperationStatus / HandlerErrorCode ---

    @Test
    void operationStatus_terminalStates() {
        assertTrue(OperationStatus.SUCCESS.isTerminal());
        assertTrue(OperationStatus.FAILED.isTerminal());
        assertFalse(OperationStatus.IN_PROGRESS.isTerminal());
    }

    @Test
    void handlerErrorCode_lookupIsExact() {
        assertEquals(HandlerErrorCode.NotFound, HandlerErrorCode.lookup("NotFound").orElseThrow());
        assertTrue(HandlerErrorCode.lookup("notfound").isEmpty());
        assertTrue(HandlerErrorCode.lookup(null).isEmpty());
    }

    // --- InvocationRequest ---

    @Test
    void invocationRequest_firstHasEmptyContext() {
        ObjectNode body = JsonNodeFactory.instance.objectNode().put("name", "x");
        InvocationRequest r = InvocationRequest.first(Action.CREATE, body, "token-1");
        assertTrue(r.callbackContext().isEmpty());
        assertEquals("token-1", r.bearerToken());
    }

    @Test
    void invocationRequest_withCallbackContextKeepsEverythingElse() {
        ObjectNode body = JsonNodeFactory.instance.objectNode().put("name", "x");
        ObjectNode ctx = JsonNodeFactory.instance.objectNode().put("step", 1);
        InvocationRequest first = InvocationRequest.first(Action.UPDATE, body, "token-2");

        InvocationRequest next = first.withCallbackContext(ctx);

        assertSame(ctx, next.callbackContext());
        assertSame(body, next.resourceRequest());
        assertEquals(Action.UPDATE, next.action());
        assertEquals("token-2", next.bearerToken());
        assertTrue(first.callbackContext().isEmpty());
    }

    @Test
    void invocationRequest_serializesWireFields() throws Exception {
        ObjectNode body = JsonNodeFactory.instance.objectNode().put("name", "x");
        InvocationRequest r = InvocationRequest.first(Action.CREATE, body, "tok");

        JsonNode json = mapper.readTree(mapper.writeValueAsString(r));

        assertEquals("CREATE", json.get("action").asText());
        assertEquals("tok", json.get("bearerToken").asText());
        assertEquals("x", json.get("resourceRequest").get("name").asText());
        assertTrue(json.get("callbackContext").isObject());
    }

    // --- ProgressEvent ---

    @Test
    void progressEvent_inProgressDefaults() {
        ProgressEvent e = ProgressEvent.inProgress(null, null);
        assertFalse(e.isTerminal());
        assertTrue(e.callbackContextOrEmpty().isEmpty());
        assertEquals(0, e.callbackDelaySecondsOrZero());
    }

    @Test
    void progressEvent_failedExposesKnownErrorCode() {
        ProgressEvent e = ProgressEvent.failed("AlreadyExists", "dup");
        assertTrue(e.isTerminal());
        assertEquals(HandlerErrorCode.AlreadyExists, e.handlerErrorCode().orElseThrow());
    }

    @Test
    void progressEvent_serializationOmitsAbsentFields() throws Exception {
        String json = mapper.writeValueAsString(ProgressEvent.success(null));
        assertEquals("{\"status\":\"SUCCESS\"}", json);
    }
}
