package com.al.ccda2omop.controller;

import com.al.ccda2omop.dto.ConversionResult;
import com.al.ccda2omop.model.rule.MappingRule;
import com.al.ccda2omop.report.ReportRenderer;
import com.al.ccda2omop.service.conversion.ConversionService;
import com.al.ccda2omop.service.conversion.DocumentResult;
import com.al.ccda2omop.service.rule.RuleSet;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@Validated
@RequestMapping("/api/convert")
@Slf4j
@Tag(name = "Conversion", description = "C-CDA to OMOP CDM conversion endpoints")
public class ConverterController {

    static final String DEFAULT_SOURCE_FILE = "document.xml";
    static final MediaType TEXT_MARKDOWN = MediaType.parseMediaType("text/markdown;charset=UTF-8");

    private final ConversionService conversionService;
    private final ReportRenderer reportRenderer;
    private final RuleSet ruleSet;

    @Autowired
    public ConverterController(ConversionService conversionService, ReportRenderer reportRenderer,
            RuleSet ruleSet) {
        this.conversionService = conversionService;
        this.reportRenderer = reportRenderer;
        this.ruleSet = ruleSet;
    }

    @Operation(summary = "Convert C-CDA to OMOP", description = "Converts one C-CDA document and returns the OMOP rows per table together with the conversion report.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Document converted"),
            @ApiResponse(responseCode = "400", description = "Document is not well-formed or could not be converted")
    })
    @PostMapping(value = "/ccda-to-omop", consumes = { MediaType.APPLICATION_XML_VALUE,
            MediaType.TEXT_XML_VALUE }, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ConversionResult> convert(
            @Parameter(description = "C-CDA document") @RequestBody(required = false) byte[] document,
            @Parameter(description = "Name recorded in each row's source file") @RequestParam(value = "sourceFile", defaultValue = DEFAULT_SOURCE_FILE) @NotBlank String sourceFile) {
        DocumentResult result = convertDocument(document, sourceFile);
        return ResponseEntity.ok(ConversionResult.of(result.getSourceFile(), result.getDataset(), result.toReport()));
    }

    @Operation(summary = "Conversion report", description = "Converts one C-CDA document and returns only the conversion report, as markdown text or JSON.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Report rendered"),
            @ApiResponse(responseCode = "400", description = "Document is not well-formed or could not be converted")
    })
    @PostMapping(value = "/ccda-to-omop/report", consumes = { MediaType.APPLICATION_XML_VALUE,
            MediaType.TEXT_XML_VALUE })
    public ResponseEntity<String> report(
            @Parameter(description = "C-CDA document") @RequestBody(required = false) byte[] document,
            @Parameter(description = "text or json") @RequestParam(value = "format", defaultValue = "text") @Pattern(regexp = "(?i)text|json", message = "must be text or json") String format,
            @RequestParam(value = "sourceFile", defaultValue = DEFAULT_SOURCE_FILE) @NotBlank String sourceFile) {
        DocumentResult result = convertDocument(document, sourceFile);
        ReportRenderer.Format renderFormat = ReportRenderer.Format.fromName(format);
        String body = reportRenderer.render(result.toReport(), renderFormat);
        MediaType contentType = renderFormat == ReportRenderer.Format.JSON ? MediaType.APPLICATION_JSON
                : TEXT_MARKDOWN;
        return ResponseEntity.ok().contentType(contentType).body(body);
    }

    @Operation(summary = "Loaded rules", description = "Lists the mapping rule names for each C-CDA section, in evaluation order.")
    @Tag(name = "Rules")
    @GetMapping(value = "/rules", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, List<String>>> rules() {
        Map<String, List<String>> bySection = new LinkedHashMap<>();
        for (MappingRule rule : ruleSet.all()) {
            bySection.computeIfAbsent(rule.getSource().getSection(), k -> new ArrayList<>()).add(rule.getName());
        }
        return ResponseEntity.ok(bySection);
    }

    private DocumentResult convertDocument(byte[] document, String sourceFile) {
        if (document == null || document.length == 0) {
            throw new IllegalArgumentException("Request body must contain a C-CDA document");
        }
        log.info("Converting {} ({} bytes)", sourceFile, document.length);
        return conversionService.convert(document, sourceFile);
    }
}
