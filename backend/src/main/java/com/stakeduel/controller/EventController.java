package com.stakeduel.controller;

import com.stakeduel.dto.EventResponses;
import com.stakeduel.mapper.StakeduelResponseMapper;
import com.stakeduel.service.EventLogService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Cursor-based feed of settlement events for downstream indexers.
 */
@RestController
@RequestMapping("/api/events")
public class EventController {

    private final EventLogService eventLogService;
    private final StakeduelResponseMapper stakeduelResponseMapper;

    public EventController(EventLogService eventLogService, StakeduelResponseMapper stakeduelResponseMapper) {
        this.eventLogService = eventLogService;
        this.stakeduelResponseMapper = stakeduelResponseMapper;
    }

    @GetMapping
    public ResponseEntity<EventResponses.EventPage> listEvents(
            @RequestParam(defaultValue = "0") @Min(0) long afterEventId,
            @RequestParam(defaultValue = "100") @Min(1) @Max(500) int limit
    ) {
        return ResponseEntity.ok(stakeduelResponseMapper.toEventPage(
                eventLogService.listEvents(afterEventId, limit),
                afterEventId
        ));
    }
}
