package com.carelink.backend.modules.profile.application;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import com.carelink.backend.modules.profile.domain.WorkerProfile;
import com.carelink.backend.modules.profile.infrastructure.persistence.WorkerProfileRepository;
import com.carelink.backend.modules.profile.presentation.dto.WorkerSearchResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Public worker directory. Only published workers whose verification was approved are listed.
 */
@Service
@Transactional(readOnly = true)
public class WorkerDirectoryService {

    private static final Logger log = LoggerFactory.getLogger(WorkerDirectoryService.class);

    static final int DEFAULT_PAGE_SIZE = 20;
    static final int MAX_PAGE_SIZE = 50;
    static final String SERVICE_DELIMITER = "|";

    private final WorkerProfileRepository workerProfileRepository;

    public WorkerDirectoryService(WorkerProfileRepository workerProfileRepository) {
        this.workerProfileRepository = workerProfileRepository;
    }

    public WorkerSearchResponse search(String text, String location, List<String> services, int page, int size) {
        int safePage = Math.max(page, 0);
        int safeSize = size <= 0 ? DEFAULT_PAGE_SIZE : Math.min(size, MAX_PAGE_SIZE);

        Page<WorkerProfile> result = workerProfileRepository.searchPublished(
                containsPattern(text),
                containsPattern(location),
                joinServices(services),
                PageRequest.of(safePage, safeSize)
        );
        log.debug("Worker search text={} location={} services={} matched={}",
                text, location, services, result.getTotalElements());

        List<WorkerSearchResponse.Worker> items = result.getContent().stream()
                .map(WorkerSearchResponse.Worker::from)
                .toList();
        return new WorkerSearchResponse(items, result.getNumber(), result.getSize(), result.getTotalElements(), result.getTotalPages());
    }

    /**
     * ILIKE pattern matching the term anywhere, with its wildcard characters escaped. Blank terms give "".
     */
    static String containsPattern(String term) {
        if (term == null || term.isBlank()) {
            return "";
        }
        String escaped = term.trim()
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
        return "%" + escaped + "%";
    }

    static String joinServices(List<String> services) {
        if (services == null) {
            return "";
        }
        // the delimiter cannot be escaped inside string_to_array, so such values are dropped
        return services.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(service -> !service.isEmpty() && !service.contains(SERVICE_DELIMITER))
                .distinct()
                .collect(Collectors.joining(SERVICE_DELIMITER));
    }
}
