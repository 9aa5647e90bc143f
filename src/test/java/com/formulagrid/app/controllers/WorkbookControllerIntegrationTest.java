package com.formulagrid.app.controllers;

import com.formulagrid.app.FormulaGridApplication;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests using a running server instance (RANDOM_PORT).
 * These tests verify end-to-end HTTP behavior and JSON handling.
 */
@SpringBootTest(
        classes = FormulaGridApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class WorkbookControllerIntegrationTest {

    private static final String TABLES = "{\n" +
            "  \"tables\": [\n" +
            "    {\"id\": \"t1\", \"name\": \"Budget\", \"cells\": [\n" +
            "      {\"row\": 2, \"column\": 2, \"cell_type\": \"value\", \"value\": 1000},\n" +
            "      {\"row\": 3, \"column\": 2, \"cell_type\": \"value\", \"value\": 500},\n" +
            "      {\"row\": 4, \"column\": 2, \"cell_type\": \"formula\", \"formula\": \"=SUM(B2:B3)\"},\n" +
            "      {\"row\": 5, \"column\": 2, \"cell_type\": \"formula\", \"formula\": \"=B4/2000\", \"format_type\": \"percentage\"},\n" +
            "      {\"row\": 1, \"column\": 1, \"cell_type\": \"link\", \"reference\": [{\"table_id\": \"t2\", \"cell_address\": \"A1\"}]},\n" +
            "      {\"row\": 9, \"column\": 9, \"cell_type\": \"empty\"}\n" +
            "    ]},\n" +
            "    {\"id\": \"t2\", \"name\": \"Links\", \"cells\": [\n" +
            "      {\"row\": 1, \"column\": 1, \"cell_type\": \"formula\", \"formula\": \"='Budget'!B4 + B1\"},\n" +
            "      {\"row\": 1, \"column\": 2, \"cell_type\": \"formula\", \"formula\": \"=A1\"}\n" +
            "    ]}\n" +
            "  ]\n" +
            "}";

    @LocalServerPort
    int port;

    private long createWorkbook(RestTemplate restTemplate) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<Long> response = restTemplate.postForEntity(
                "http://localhost:" + port + "/workbook", new HttpEntity<>(TABLES, headers), Long.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertNotNull(response.getBody());
        return response.getBody();
    }

    /**
     * Creates a workbook, evaluates it, and checks the rendered cells.
     */
    @Test
    @SuppressWarnings("unchecked")
    void testCreateAndEvaluateWorkbook() {
        RestTemplate restTemplate = new RestTemplate();
        long workbookId = createWorkbook(restTemplate);

        String url = "http://localhost:" + port + "/workbook/" + workbookId;
        ResponseEntity<Map> response = restTemplate.getForEntity(url, Map.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        Map<String, List<Map<String, Object>>> tables = response.getBody();
        assertNotNull(tables);

        List<Map<String, Object>> t1 = tables.get("t1");
        assertEquals(5, t1.size());
        Map<String, Object> sum = t1.get(2);
        assertEquals("B4", sum.get("address"));
        assertEquals("FORMULA", sum.get("kind"));
        assertEquals(1500L, ((Number) sum.get("value")).longValue());
        assertEquals("=SUM(B2:B3)", sum.get("formula"));
        assertFalse(sum.containsKey("error"));

        assertEquals(0.75, ((Number) t1.get(3).get("value")).doubleValue(), 1e-12);
        assertEquals("t2!A1", t1.get(4).get("target"));

        // t2!A1 <-> t2!B1 loops, even though A1 also reads from another table
        List<Map<String, Object>> t2 = tables.get("t2");
        assertEquals("CIRCULAR_DEPENDENCY", t2.get(0).get("errorKind"));
        assertEquals("CIRCULAR_DEPENDENCY", t2.get(1).get("errorKind"));

        ResponseEntity<Map> recalculated = restTemplate.postForEntity(url + "/recalculate", null, Map.class);
        assertEquals(HttpStatus.OK, recalculated.getStatusCode());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testCellDependenciesAndLinks() {
        RestTemplate restTemplate = new RestTemplate();
        long workbookId = createWorkbook(restTemplate);
        String tableUrl = "http://localhost:" + port + "/workbook/" + workbookId + "/table/t1";

        Map<String, Object> cell = restTemplate.getForObject(tableUrl + "/cell/B4", Map.class);
        assertNotNull(cell);
        assertEquals(1500L, ((Number) cell.get("value")).longValue());

        Map<String, List<String>> dependencies = restTemplate.getForObject(tableUrl + "/dependencies", Map.class);
        assertNotNull(dependencies);
        assertEquals(List.of("B2", "B3"), dependencies.get("B4"));
        assertEquals(List.of("B4"), dependencies.get("B5"));

        List<String> links = restTemplate.getForObject(tableUrl + "/links", List.class);
        assertEquals(List.of("t2"), links);
    }

    /**
     * Unknown ids and malformed addresses come back as 4xx with an error body.
     */
    @Test
    void testErrors() {
        RestTemplate restTemplate = new RestTemplate();
        long workbookId = createWorkbook(restTemplate);
        String base = "http://localhost:" + port + "/workbook/";

        HttpClientErrorException missing = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.getForEntity(base + "999999", Map.class));
        assertEquals(HttpStatus.NOT_FOUND, missing.getStatusCode());
        assertTrue(missing.getResponseBodyAsString().contains("WORKBOOK_NOT_FOUND"));

        HttpClientErrorException badAddress = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.getForEntity(base + workbookId + "/table/t1/cell/A0", Map.class));
        assertEquals(HttpStatus.BAD_REQUEST, badAddress.getStatusCode());

        HttpClientErrorException missingCell = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.getForEntity(base + workbookId + "/table/t1/cell/Z99", Map.class));
        assertEquals(HttpStatus.NOT_FOUND, missingCell.getStatusCode());
        assertTrue(missingCell.getResponseBodyAsString().contains("t1!Z99"));

        HttpClientErrorException missingTable = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.getForEntity(base + workbookId + "/table/t9/links", List.class));
        assertEquals(HttpStatus.NOT_FOUND, missingTable.getStatusCode());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpClientErrorException empty = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.postForEntity(base, new HttpEntity<>("{\"tables\": []}", headers), Long.class));
        assertEquals(HttpStatus.BAD_REQUEST, empty.getStatusCode());
    }
}
