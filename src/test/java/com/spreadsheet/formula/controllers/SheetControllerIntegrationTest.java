package com.spreadsheet.formula.controllers;

import com.spreadsheet.formula.FormulaEngineApplication;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests using a running server instance (RANDOM_PORT).
 * These tests verify end-to-end HTTP behavior and JSON handling.
 */
@SpringBootTest(
        classes = FormulaEngineApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class SheetControllerIntegrationTest {

    @LocalServerPort
    int port;

    private final RestTemplate restTemplate = new RestTemplate();
    private String baseUrl;
    private HttpHeaders textHeaders;

    @BeforeEach
    void setUp() {
        baseUrl = "http://localhost:" + port + "/sheet";
        textHeaders = new HttpHeaders();
        textHeaders.setContentType(MediaType.TEXT_PLAIN);
    }

    private long createSheet(String name) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String body = "{ \"name\": \"" + name + "\" }";
        ResponseEntity<Long> response = restTemplate.postForEntity(baseUrl, new HttpEntity<>(body, headers), Long.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertNotNull(response.getBody());
        return response.getBody();
    }

    private void setCell(long sheetId, String ref, String raw) {
        restTemplate.exchange(baseUrl + "/" + sheetId + "/cell/" + ref, HttpMethod.PUT,
                new HttpEntity<>(raw, textHeaders), Void.class);
    }

    /**
     * A1=10, A2=20, A3==A1+A2, then A1=15 => A3 follows.
     */
    @Test
    void testSetCellsAndRecalculate() {
        long sheetId = createSheet("damage");

        setCell(sheetId, "A1", "10");
        setCell(sheetId, "A2", "20");
        setCell(sheetId, "A3", "=A1+A2");

        ResponseEntity<Map> sheet = restTemplate.getForEntity(baseUrl + "/" + sheetId, Map.class);
        assertEquals(HttpStatus.OK, sheet.getStatusCode());
        assertEquals(30.0, sheet.getBody().get("A3"));

        setCell(sheetId, "A1", "15");
        sheet = restTemplate.getForEntity(baseUrl + "/" + sheetId, Map.class);
        assertEquals(35.0, sheet.getBody().get("A3"));
    }

    @Test
    void testGetSingleCell() {
        long sheetId = createSheet("cells");
        setCell(sheetId, "B2", "=UPPER(\"rare\")");

        ResponseEntity<Map> response = restTemplate.getForEntity(baseUrl + "/" + sheetId + "/cell/B2", Map.class);
        Map body = response.getBody();
        assertEquals("B2", body.get("reference"));
        assertEquals("RARE", body.get("value"));
        assertEquals("=UPPER(\"rare\")", body.get("formula"));
        assertEquals("text", body.get("type"));

        Map empty = restTemplate.getForEntity(baseUrl + "/" + sheetId + "/cell/C9", Map.class).getBody();
        assertEquals("C9", empty.get("reference"));
        assertNull(empty.get("value"));
    }

    /**
     * A broken formula is still stored; the cell shows the error.
     */
    @Test
    void testFormulaErrorIsStoredNotRejected() {
        long sheetId = createSheet("errors");
        ResponseEntity<Void> response = restTemplate.exchange(baseUrl + "/" + sheetId + "/cell/A1", HttpMethod.PUT,
                new HttpEntity<>("=1/0", textHeaders), Void.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());

        Map body = restTemplate.getForEntity(baseUrl + "/" + sheetId, Map.class).getBody();
        assertEquals("#ERROR: Division by zero", body.get("A1"));
    }

    @Test
    void testInvalidCellReferenceIsBadRequest() {
        long sheetId = createSheet("refs");
        HttpClientErrorException ex = assertThrows(HttpClientErrorException.class,
                () -> setCell(sheetId, "1A", "x"));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        assertTrue(ex.getResponseBodyAsString().contains("INVALID_CELL_REFERENCE"));
    }

    @Test
    void testUnknownSheetIsNotFound() {
        HttpClientErrorException ex = assertThrows(HttpClientErrorException.class,
                () -> restTemplate.getForEntity(baseUrl + "/999999", Map.class));
        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
        assertTrue(ex.getResponseBodyAsString().contains("SHEET_NOT_FOUND"));
    }

    @Test
    void testEvaluateEndpoint() {
        long sheetId = createSheet("eval");
        setCell(sheetId, "A1", "2");
        setCell(sheetId, "A2", "4");

        ResponseEntity<Map> response = restTemplate.postForEntity(baseUrl + "/" + sheetId + "/evaluate",
                new HttpEntity<>("=AVERAGE(A1:A2)*10", textHeaders), Map.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(30.0, response.getBody().get("value"));
        assertEquals("number", response.getBody().get("type"));

        HttpClientErrorException ex = assertThrows(HttpClientErrorException.class,
                () -> restTemplate.postForEntity(baseUrl + "/" + sheetId + "/evaluate",
                        new HttpEntity<>("=FOO(A1)", textHeaders), Map.class));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        assertTrue(ex.getResponseBodyAsString().contains("UNKNOWN_FUNCTION"));

        // Nothing from the ad-hoc formulas stays in the graph
        Map forward = restTemplate.getForEntity(baseUrl + "/" + sheetId + "/forwardDependencies", Map.class).getBody();
        assertTrue(forward.isEmpty());
    }

    @Test
    void testDependencyGraphs() {
        long sheetId = createSheet("graph");
        setCell(sheetId, "B1", "=C2");
        setCell(sheetId, "A1", "=B1+SUM(C1:C2)");

        Map<String, List<String>> forward = restTemplate
                .getForEntity(baseUrl + "/" + sheetId + "/forwardDependencies", Map.class).getBody();
        assertEquals(Collections.singletonList("C2"), forward.get("B1"));
        assertEquals(Arrays.asList("B1", "C1", "C2"), forward.get("A1"));

        Map<String, List<String>> reverse = restTemplate
                .getForEntity(baseUrl + "/" + sheetId + "/reverseDependencies", Map.class).getBody();
        assertEquals(Arrays.asList("A1", "B1"), reverse.get("C2"));
        assertEquals(Collections.singletonList("A1"), reverse.get("B1"));
        assertFalse(reverse.containsKey("A1"));
    }

    @Test
    void testCacheStats() {
        long sheetId = createSheet("cache");
        setCell(sheetId, "A1", "1");
        setCell(sheetId, "B1", "=A1*3");

        Map stats = restTemplate.getForEntity(baseUrl + "/" + sheetId + "/cache/stats", Map.class).getBody();
        assertEquals(1, stats.get("size"));
        assertEquals(1, stats.get("dependencies"));
        assertNotNull(stats.get("oldestEntry"));
    }
}
