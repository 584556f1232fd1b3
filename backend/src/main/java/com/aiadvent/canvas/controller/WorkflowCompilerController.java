package com.aiadvent.canvas.controller;

import com.aiadvent.canvas.api.AncestorsResponse;
import com.aiadvent.canvas.api.WorkflowCompileRequest;
import com.aiadvent.canvas.api.WorkflowCompileResponse;
import com.aiadvent.canvas.service.CompileResult;
import com.aiadvent.canvas.service.WorkflowCompiler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/workflows")
public class WorkflowCompilerController {

  private final WorkflowCompiler workflowCompiler;

  public WorkflowCompilerController(WorkflowCompiler workflowCompiler) {
    this.workflowCompiler = workflowCompiler;
  }

  @PostMapping("/compile")
  public WorkflowCompileResponse compile(@RequestBody WorkflowCompileRequest request) {
    CompileResult result = workflowCompiler.compile(request);
    return new WorkflowCompileResponse(result.code(), result.diagnostics(), !result.hasErrors());
  }

  @PostMapping("/ancestors")
  public AncestorsResponse ancestors(
      @RequestParam("nodeId") String nodeId, @RequestBody WorkflowCompileRequest request) {
    return new AncestorsResponse(nodeId, workflowCompiler.ancestorsOf(request, nodeId));
  }
}
