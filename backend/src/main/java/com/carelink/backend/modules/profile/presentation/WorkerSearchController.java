package com.carelink.backend.modules.profile.presentation;

import java.util.List;

import com.carelink.backend.modules.profile.application.WorkerDirectoryService;
import com.carelink.backend.modules.profile.presentation.dto.WorkerSearchResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class WorkerSearchController {

    private final WorkerDirectoryService workerDirectoryService;

    public WorkerSearchController(WorkerDirectoryService workerDirectoryService) {
        this.workerDirectoryService = workerDirectoryService;
    }

    @Operation(summary = "Search published workers",
            description = "Matches name or introduction, location text (location, city, state, postcode) and any of the given services. Newest profiles first.")
    @GetMapping("/workers/search")
    public ResponseEntity<WorkerSearchResponse> search(
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "location", required = false) String location,
            @RequestParam(name = "services", required = false) List<String> services,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(workerDirectoryService.search(search, location, services, page, size));
    }
}
