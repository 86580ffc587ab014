package taskhub.coordinator.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.handler.codec.http.HttpResponseStatus;
import taskhub.coordinator.api.Controller.ControllerResponse;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ControllerResponseTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void errorMessageSurvivesAsJson() throws Exception {
        String message = "Illegal character '\t' in \"1\t2\"\nat C:\\input\u0001";

        ControllerResponse response = ControllerResponse.badRequest(message);

        assertEquals(HttpResponseStatus.BAD_REQUEST, response.status());
        assertEquals("application/json", response.contentType());
        assertEquals(message, MAPPER.readTree(response.body()).get("error").asText());
    }

    @Test
    void nullMessageBecomesEmpty() throws Exception {
        ControllerResponse response = ControllerResponse.notFound(null);

        assertEquals(HttpResponseStatus.NOT_FOUND, response.status());
        assertEquals("", MAPPER.readTree(response.body()).get("error").asText());
    }
}
