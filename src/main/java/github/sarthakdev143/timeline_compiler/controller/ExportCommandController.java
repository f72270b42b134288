package github.sarthakdev143.timeline_compiler.controller;

import github.sarthakdev143.timeline_compiler.dto.ExportCommandResponse;
import github.sarthakdev143.timeline_compiler.dto.ExportRequest;
import github.sarthakdev143.timeline_compiler.dto.HardwareCapabilitiesResponse;
import github.sarthakdev143.timeline_compiler.exception.MissingAssetException;
import github.sarthakdev143.timeline_compiler.exception.TimelineContractException;
import github.sarthakdev143.timeline_compiler.model.Canvas;
import github.sarthakdev143.timeline_compiler.model.CompiledCommand;
import github.sarthakdev143.timeline_compiler.model.ExportDefinition;
import github.sarthakdev143.timeline_compiler.service.TimelineCompilationService;
import github.sarthakdev143.timeline_compiler.service.impl.ExportRequestValidator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/export")
public class ExportCommandController {

    private static final Logger logger = LoggerFactory.getLogger(ExportCommandController.class);

    private final TimelineCompilationService compilationService;
    private final ExportRequestValidator requestValidator;

    public ExportCommandController(TimelineCompilationService compilationService, ExportRequestValidator requestValidator) {
        this.compilationService = compilationService;
        this.requestValidator = requestValidator;
    }

    @PostMapping(value = "/command", consumes = "application/json")
    public ResponseEntity<?> compileCommand(@RequestBody(required = false) ExportRequest request) {
        try {
            ExportDefinition definition = requestValidator.normalizeAndValidate(request);
            CompiledCommand compiled = compilationService.compile(definition.tracks(), definition.job());
            return ResponseEntity.ok(toResponse(compiled));
        } catch (IllegalArgumentException | TimelineContractException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (MissingAssetException e) {
            return ResponseEntity.unprocessableEntity().body(e.getMessage());
        } catch (Exception e) {
            logger.error("Export command compilation failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to compile export command. Please try again.");
        }
    }

    @GetMapping("/hardware")
    public ResponseEntity<HardwareCapabilitiesResponse> hardware() {
        return ResponseEntity.ok(HardwareCapabilitiesResponse.from(compilationService.hardwareCapabilities()));
    }

    @PostMapping("/hardware/refresh")
    public ResponseEntity<HardwareCapabilitiesResponse> refreshHardware() {
        logger.info("Hardware capability refresh requested");
        return ResponseEntity.ok(HardwareCapabilitiesResponse.from(compilationService.refreshHardwareCapabilities()));
    }

    private ExportCommandResponse toResponse(CompiledCommand compiled) {
        Canvas working = compiled.canvasPlan().working();
        Canvas output = compiled.canvasPlan().desired();
        return new ExportCommandResponse(
                compiled.argv(),
                compiled.graph().filterComplex(),
                compiled.hardware().type(),
                compiled.videoCodec(),
                compiled.totalDurationSec(),
                working.width(),
                working.height(),
                output.width(),
                output.height(),
                compiled.canvasPlan().policy(),
                compiled.graph().skippedSegments());
    }
}
