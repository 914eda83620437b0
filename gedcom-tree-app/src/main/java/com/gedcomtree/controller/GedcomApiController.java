package com.gedcomtree.controller;

import com.gedcomtree.exception.GedcomParseException;
import com.gedcomtree.service.GedcomService;
import com.gedcomtree.service.GedcomService.GedcomSummary;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/gedcom")
public class GedcomApiController {

    private final GedcomService gedcomService;

    public GedcomApiController(GedcomService gedcomService) {
        this.gedcomService = gedcomService;
    }

    /**
     * Parse a GEDCOM body and list its individuals and families.
     */
    @PostMapping(value = "/summary", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<GedcomSummary> summarize(@RequestBody String body) {
        if (body == null || body.isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(gedcomService.summarize(gedcomService.parse(body)));
    }

    /**
     * Parse a GEDCOM body and write it back out with canonical line wrapping.
     */
    @PostMapping(value = "/normalize", consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> normalize(
            @RequestBody String body,
            @RequestParam(defaultValue = "false") boolean header) {

        if (body == null || body.isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(gedcomService.normalize(body, header));
    }

    @ExceptionHandler(GedcomParseException.class)
    public ResponseEntity<Map<String, Object>> handleParseError(GedcomParseException e) {
        return ResponseEntity.badRequest().body(Map.of(
            "error", e.getMessage(),
            "line", e.getLineNumber()
        ));
    }
}
