package dev.reviewgate.controller;

import dev.reviewgate.dto.request.ToolRequest;
import dev.reviewgate.dto.response.ToolResponse;
import dev.reviewgate.service.ReviewToolService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Set;

/**
 * HTTP surface of the tool operations: {@code POST /tools/{operation}} with a JSON body of
 * arguments. Operation failures come back as 200 with {@code success=false}.
 */
@RestController
@RequestMapping("/tools")
public class ReviewToolController {
    private final ReviewToolService toolService;
    public ReviewToolController(ReviewToolService toolService) { this.toolService = toolService; }

    @GetMapping
    public Set<String> operations() {
        return toolService.operationNames();
    }

    @PostMapping("/{operation}")
    public ResponseEntity<ToolResponse> invoke(@PathVariable String operation,
                                               @RequestBody(required = false) ToolRequest request) {
        return ResponseEntity.ok(toolService.invoke(operation, request));
    }
}
