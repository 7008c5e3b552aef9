package com.routewise.dispatch.api;

import java.util.List;

public record RecommendRequest(
    String context,
    List<String> exclude
) {}
