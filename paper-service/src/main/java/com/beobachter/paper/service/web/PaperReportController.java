package com.beobachter.paper.service.web;

import com.beobachter.paper.domain.Position;
import com.beobachter.paper.service.report.PerformanceReport;
import com.beobachter.paper.service.report.PerformanceReportService;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/paper/report")
@RequiredArgsConstructor
public class PaperReportController {

  private final @NonNull PerformanceReportService reportService;

  @GetMapping("/closed-positions")
  public ResponseEntity<List<Position>> closedPositions() {
    return ResponseEntity.ok(reportService.closedPositions());
  }

  @GetMapping("/performance")
  public ResponseEntity<PerformanceReport> performance() {
    return ResponseEntity.ok(reportService.report());
  }
}
