package com.aiadvent.canvas.api;

import java.util.List;

public record WorkflowCompileResponse(
    String code, List<CompileDiagnostic> diagnostics, boolean valid) {}
