package it.unimib.datai.handlerharness.core.event;

import it.unimib.datai.handlerharness.common.model.OperationStatus;
import it.unimib.datai.handlerharness.common.model.ProgressEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static it.unimib.datai.handlerharness.core.testsupport.ScriptedHandlerClient.object;
import static it.unimib.datai.handlerharness.core.testsupport.ScriptedHandlerClient.raw;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProgressEventParserTest {

    private final ProgressEventParser parser = new ProgressEventParser();

    private ParsedProgressEvent parse(String json) {
        return parser.parse(raw(json));
    }

    private ProgressEventValidationException rejected(String json) {
        try {
            parse(json);
        } catch (ProgressEventValidationException e) {
            return e;
        }
        throw new AssertionError("expected rejection of " + json);
    }

    @Test
    void successCarriesResourceModel() {
        ParsedProgressEvent parsed = parse("{\"status\":\"SUCCESS\",\"message\":\"done\","
                + "\"resourceModel\":{\"id\":\"r-1\",\"tags\":[\"a\"]}}");

        ProgressEvent event = parsed.event();
        assertThat(event.status()).isEqualTo(OperationStatus.SUCCESS);
        assertThat(event.message()).isEqualTo("done");
        assertThat(event.resourceModel()).isEqualTo(object("{\"id\":\"r-1\",\"tags\":[\"a\"]}"));
        assertThat(parsed.warnings()).isEmpty();
    }

    @Test
    void listSuccessCarriesModelsAndNextToken() {
        ProgressEvent event = parse("{\"status\":\"SUCCESS\",\"resourceModels\":[{\"id\":1},{\"id\":2}],"
                + "\"nextToken\":\"page-2\"}").event();

        assertThat(event.resourceModels()).hasSize(2);
        assertThat(event.nextToken()).isEqualTo("page-2");
    }

    @Test
    void unknownFieldsAreIgnored() {
        ParsedProgressEvent parsed = parse("{\"status\":\"SUCCESS\",\"extra\":{\"x\":1},\"resourceModel\":null}");

        assertThat(parsed.event().resourceModel()).isNull();
        assertThat(parsed.warnings()).isEmpty();
    }

    @Test
    void inProgressDefaultsToEmptyContextAndNoDelay() {
        ProgressEvent event = parse("{\"status\":\"IN_PROGRESS\"}").event();

        assertThat(event.callbackContext()).isNull();
        assertThat(event.callbackContextOrEmpty()).isEmpty();
        assertThat(event.callbackDelaySeconds()).isNull();
        assertThat(event.callbackDelaySecondsOrZero()).isZero();
    }

    @Test
    void inProgressKeepsContextAndDelay() {
        ProgressEvent event = parse("{\"status\":\"IN_PROGRESS\",\"callbackContext\":{\"step\":2},"
                + "\"callbackDelaySeconds\":15}").event();

        assertThat(event.callbackContext()).isEqualTo(object("{\"step\":2}"));
        assertThat(event.callbackDelaySeconds()).isEqualTo(15);
    }

    @Test
    void nullCallbackContextCountsAsAbsent() {
        ProgressEvent event = parse("{\"status\":\"IN_PROGRESS\",\"callbackContext\":null}").event();
        assertThat(event.callbackContextOrEmpty()).isEmpty();
    }

    @Test
    void failedKeepsErrorCodeVerbatim() {
        ProgressEvent event = parse("{\"status\":\"FAILED\",\"errorCode\":\"AlreadyExists\","
                + "\"message\":\"duplicate\"}").event();

        assertThat(event.errorCode()).isEqualTo("AlreadyExists");
        assertThat(event.message()).isEqualTo("duplicate");
    }

    @Test
    void missingStatusIsRejected() {
        ProgressEventValidationException e = rejected("{\"message\":\"hello\"}");
        assertThat(e.failure()).isEqualTo(ValidationFailure.UNKNOWN_STATUS);
        assertThat(e.rawBody()).isEqualTo("{\"message\":\"hello\"}");
    }

    @ParameterizedTest
    @ValueSource(strings = {"{\"status\":\"PENDING\"}", "{\"status\":\"success\"}", "{\"status\":1}",
            "{\"status\":null}"})
    void unrecognisedStatusIsRejected(String json) {
        assertThat(rejected(json).failure()).isEqualTo(ValidationFailure.UNKNOWN_STATUS);
    }

    @Test
    void failedWithoutErrorCodeIsRejected() {
        assertThat(rejected("{\"status\":\"FAILED\",\"message\":\"boom\"}").failure())
                .isEqualTo(ValidationFailure.MISSING_ERROR_CODE);
        assertThat(rejected("{\"status\":\"FAILED\",\"errorCode\":\"\"}").failure())
                .isEqualTo(ValidationFailure.MISSING_ERROR_CODE);
    }

    @ParameterizedTest
    @ValueSource(strings = {"-1", "1.5", "\"5\"", "true"})
    void invalidInProgressDelayIsRejected(String delay) {
        String json = "{\"status\":\"IN_PROGRESS\",\"callbackDelaySeconds\":" + delay + "}";
        assertThat(rejected(json).failure()).isEqualTo(ValidationFailure.INVALID_DELAY);
    }

    @ParameterizedTest
    @ValueSource(strings = {"\"ctx\"", "[1,2]", "7"})
    void inProgressWithNonObjectCallbackContextIsRejected(String context) {
        String json = "{\"status\":\"IN_PROGRESS\",\"callbackContext\":" + context + "}";
        assertThatThrownBy(() -> parse(json))
                .isInstanceOf(ProgressEventValidationException.class)
                .extracting(e -> ((ProgressEventValidationException) e).failure())
                .isEqualTo(ValidationFailure.INVALID_CALLBACK_CONTEXT);
    }

    @Test
    void successWithErrorCodeWarns() {
        assertThat(parse("{\"status\":\"SUCCESS\",\"errorCode\":\"NotFound\"}").warnings())
                .extracting(ContractWarning::code)
                .containsExactly(WarningCode.SUCCESS_WITH_ERROR_CODE);
    }

    @Test
    void successWithAnyCallbackContextWarns() {
        assertThat(parse("{\"status\":\"SUCCESS\",\"callbackContext\":{\"a\":1}}").warnings())
                .extracting(ContractWarning::code)
                .containsExactly(WarningCode.SUCCESS_WITH_CALLBACK_CONTEXT);
        assertThat(parse("{\"status\":\"SUCCESS\",\"callbackContext\":{}}").warnings())
                .extracting(ContractWarning::code)
                .containsExactly(WarningCode.SUCCESS_WITH_CALLBACK_CONTEXT);
    }

    @Test
    void successWithNonObjectCallbackContextKeepsStatus() {
        ParsedProgressEvent parsed = parse("{\"status\":\"SUCCESS\",\"callbackContext\":\"left\","
                + "\"resourceModel\":{\"id\":\"r-1\"}}");

        assertThat(parsed.event().status()).isEqualTo(OperationStatus.SUCCESS);
        assertThat(parsed.event().callbackContext()).isNull();
        assertThat(parsed.event().resourceModel().get("id").asText()).isEqualTo("r-1");
        assertThat(parsed.warnings()).extracting(ContractWarning::code)
                .containsExactly(WarningCode.SUCCESS_WITH_CALLBACK_CONTEXT);
    }

    @Test
    void failedWithNonObjectCallbackContextKeepsErrorCodeAndMessage() {
        ParsedProgressEvent parsed = parse("{\"status\":\"FAILED\",\"errorCode\":\"NotFound\","
                + "\"message\":\"m\",\"callbackContext\":[1]}");

        assertThat(parsed.event().status()).isEqualTo(OperationStatus.FAILED);
        assertThat(parsed.event().errorCode()).isEqualTo("NotFound");
        assertThat(parsed.event().message()).isEqualTo("m");
        assertThat(parsed.warnings()).extracting(ContractWarning::code)
                .containsExactly(WarningCode.FAILED_WITH_CALLBACK_CONTEXT);
    }

    @Test
    void failedWithObjectCallbackContextWarns() {
        ParsedProgressEvent parsed = parse("{\"status\":\"FAILED\",\"errorCode\":\"Throttling\","
                + "\"message\":\"slow\",\"callbackContext\":{\"retry\":2}}");

        assertThat(parsed.event().callbackContext()).isEqualTo(object("{\"retry\":2}"));
        assertThat(parsed.warnings()).extracting(ContractWarning::code)
                .containsExactly(WarningCode.FAILED_WITH_CALLBACK_CONTEXT);
    }

    @Test
    void terminalWithDelayWarns() {
        assertThat(parse("{\"status\":\"FAILED\",\"errorCode\":\"Throttling\",\"message\":\"slow down\","
                + "\"callbackDelaySeconds\":5}").warnings())
                .extracting(ContractWarning::code)
                .containsExactly(WarningCode.TERMINAL_WITH_CALLBACK_DELAY);
        assertThat(parse("{\"status\":\"SUCCESS\",\"callbackDelaySeconds\":0}").warnings()).isEmpty();
    }

    @Test
    void terminalEventIgnoresDelay() {
        assertThat(parse("{\"status\":\"SUCCESS\",\"callbackDelaySeconds\":5}").event().callbackDelaySeconds())
                .isNull();
    }

    @Test
    void failedWithUnknownCodeAndNoMessageWarnsTwice() {
        ParsedProgressEvent parsed = parse("{\"status\":\"FAILED\",\"errorCode\":\"Kaboom\"}");

        assertThat(parsed.event().errorCode()).isEqualTo("Kaboom");
        assertThat(parsed.warnings()).extracting(ContractWarning::code)
                .containsExactly(WarningCode.UNKNOWN_ERROR_CODE, WarningCode.FAILED_WITHOUT_MESSAGE);
    }

    @Test
    void inProgressWithErrorCodeOrModelsWarns() {
        ParsedProgressEvent parsed = parse("{\"status\":\"IN_PROGRESS\",\"errorCode\":\"Throttling\","
                + "\"resourceModels\":[]}");

        assertThat(parsed.warnings()).extracting(ContractWarning::code)
                .containsExactly(WarningCode.IN_PROGRESS_WITH_ERROR_CODE,
                        WarningCode.IN_PROGRESS_WITH_RESOURCE_MODELS);
    }

    @Test
    void warningsAreNotYetAttributedToAnInvocation() {
        assertThat(parse("{\"status\":\"SUCCESS\",\"errorCode\":\"x\"}").warnings().get(0).invocation()).isZero();
    }
}
