package com.aiadvent.canvas.api;

import com.aiadvent.canvas.reference.AncestorInfo;
import java.util.List;

public record AncestorsResponse(String nodeId, List<AncestorInfo> ancestors) {}
