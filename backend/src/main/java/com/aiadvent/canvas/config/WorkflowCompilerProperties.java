package com.aiadvent.canvas.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.workflow.compiler")
public class WorkflowCompilerProperties {

  /** Largest canvas the compiler accepts; bigger graphs are rejected with a structural error. */
  private int maxNodes = 100;

  /** Upper bound accepted for a feedback loop's {@code maxIterations}. */
  private int maxLoopIterations = 1000;

  /** Spaces per indentation level in the generated program. */
  private int indent = 4;

  private String entryFunction = "workflow";

  /** Python module the generated program imports its runtime primitives from. */
  private String runtimeModule = "agentchord.runtime";

  /** Value passed to the entry function by the generated {@code __main__} block. */
  private String sampleInput = "Your input here";

  public int getMaxNodes() {
    return maxNodes;
  }

  public void setMaxNodes(int maxNodes) {
    this.maxNodes = maxNodes;
  }

  public int getMaxLoopIterations() {
    return maxLoopIterations;
  }

  public void setMaxLoopIterations(int maxLoopIterations) {
    this.maxLoopIterations = maxLoopIterations;
  }

  public int getIndent() {
    return indent;
  }

  public void setIndent(int indent) {
    this.indent = indent;
  }

  public String getEntryFunction() {
    return entryFunction;
  }

  public void setEntryFunction(String entryFunction) {
    this.entryFunction = entryFunction;
  }

  public String getRuntimeModule() {
    return runtimeModule;
  }

  public void setRuntimeModule(String runtimeModule) {
    this.runtimeModule = runtimeModule;
  }

  public String getSampleInput() {
    return sampleInput;
  }

  public void setSampleInput(String sampleInput) {
    this.sampleInput = sampleInput;
  }
}
