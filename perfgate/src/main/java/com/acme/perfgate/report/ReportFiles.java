package com.acme.perfgate.report;

import java.nio.file.Path;

public record ReportFiles(Path timestamped, Path latest, Path summaryJson) {
}
