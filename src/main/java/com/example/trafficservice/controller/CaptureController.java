package com.example.trafficservice.controller;

import com.example.trafficservice.model.CaptureAnalysis;
import com.example.trafficservice.model.CaptureJob;
import com.example.trafficservice.service.CapturePipelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

/**
 * REST API for analysing HAR captures, inline or as background jobs.
 *
 * <h3>Endpoints:</h3>
 * <ul>
 *   <li>POST /api/captures/parse - Analyse an uploaded capture and return the endpoint catalogue</li>
 *   <li>POST /api/captures/jobs - Queue an uploaded capture for background analysis</li>
 *   <li>GET /api/captures/jobs/{jobId} - Poll a job; the result is present once it completed</li>
 *   <li>DELETE /api/captures/jobs/{jobId} - Cancel a queued or running job</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/captures")
@RequiredArgsConstructor
@Slf4j
public class CaptureController {

    private final CapturePipelineService pipelineService;

    @PostMapping(value = "/parse", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<CaptureAnalysis> parse(@RequestParam("file") MultipartFile file) {
        log.info("Parsing uploaded capture {} ({} bytes)", file.getOriginalFilename(), file.getSize());
        return ResponseEntity.ok(pipelineService.parseCapture(file));
    }

    @PostMapping(value = "/jobs", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<CaptureJob> submitJob(@RequestParam("file") MultipartFile file) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(pipelineService.submitJob(file));
    }

    @GetMapping("/jobs")
    public ResponseEntity<List<CaptureJob>> getJobs() {
        return ResponseEntity.ok(pipelineService.listJobs());
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<CaptureJob> getJob(@PathVariable String jobId) {
        return ResponseEntity.ok(pipelineService.getJob(jobId));
    }

    @DeleteMapping("/jobs/{jobId}")
    public ResponseEntity<CaptureJob> cancelJob(@PathVariable String jobId) {
        return ResponseEntity.ok(pipelineService.cancelJob(jobId));
    }
}
