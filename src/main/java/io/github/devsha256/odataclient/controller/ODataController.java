package io.github.devsha256.odataclient.controller;

import io.github.devsha256.odataclient.dto.ODataMetadataRequest;
import io.github.devsha256.odataclient.dto.ODataQueryRequest;
import io.github.devsha256.odataclient.model.PropertyInfo;
import io.github.devsha256.odataclient.service.ODataGatewayService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Errors are mapped to responses by {@link io.github.devsha256.odataclient.exception.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/odata")
public class ODataController {

    private final ODataGatewayService gatewayService;

    public ODataController(ODataGatewayService gatewayService) {
        this.gatewayService = gatewayService;
    }

    /**
     * POST /api/odata/metadata
     * Request: { url, username, password, entitySet? }
     * If entitySet is present, returns only that entity set's properties.
     */
    @PostMapping("/metadata")
    public ResponseEntity<Map<String, List<PropertyInfo>>> metadata(@RequestBody @Valid ODataMetadataRequest request) {
        return ResponseEntity.ok(gatewayService.fetchMetadata(request));
    }

    /**
     * POST /api/odata/query
     * Request: { url, username, password, entitySet, filters?, orderBy?, expand?, select?,
     *            skip?, top?, searchTerm?, inlineCount? }
     * Response: JSON array of records, all pages included
     */
    @PostMapping("/query")
    public ResponseEntity<List<Map<String, Object>>> query(@RequestBody @Valid ODataQueryRequest request) {
        return ResponseEntity.ok(gatewayService.queryEntitySet(request));
    }

    /**
     * POST /api/odata/count
     * Same request as /query; response: { "count": n }
     */
    @PostMapping("/count")
    public ResponseEntity<Map<String, Long>> count(@RequestBody @Valid ODataQueryRequest request) {
        return ResponseEntity.ok(Map.of("count", gatewayService.countEntitySet(request)));
    }
}
