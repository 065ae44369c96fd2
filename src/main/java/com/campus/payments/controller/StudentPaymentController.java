package com.campus.payments.controller;

import com.campus.payments.dto.StudentPaymentStatusView;
import com.campus.payments.service.StudentPaymentProjectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/students/{studentId}/payment-status")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Student payment status", description = "Payment standing kept on the student record")
public class StudentPaymentController {

    private final StudentPaymentProjectionService projectionService;

    @Operation(summary = "Get a student's payment status")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Payment status"),
            @ApiResponse(responseCode = "404", description = "Student not found")
    })
    @GetMapping
    public ResponseEntity<StudentPaymentStatusView> getPaymentStatus(
            @Parameter(description = "Student ID") @PathVariable Long studentId) {
        return ResponseEntity.ok(projectionService.getPaymentStatus(studentId));
    }

    @Operation(
            summary = "Rebuild a student's payment status",
            description = "Recomputes status, last paid term and history from the student's successful transactions."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Rebuilt payment status"),
            @ApiResponse(responseCode = "404", description = "Student not found")
    })
    @PostMapping("/rebuild")
    public ResponseEntity<StudentPaymentStatusView> rebuild(
            @Parameter(description = "Student ID") @PathVariable Long studentId) {
        log.info("Payment status rebuild requested for student {}", studentId);
        return ResponseEntity.ok(projectionService.rebuild(studentId));
    }
}
