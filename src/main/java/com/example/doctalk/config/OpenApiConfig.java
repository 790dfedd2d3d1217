package com.example.doctalk.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "DocTalk API",
                version = "v1",
                description = "Ask questions about your uploaded documents. Answers stream as text/plain "
                        + "with a trailing sources block; every call carries the gateway's X-User-Id header."
        ),
        tags = {
                @Tag(name = "chat", description = "POST /api/chat, streamed answer with citations (chat budget)"),
                @Tag(name = "settings", description = "Read and switch the workspace persona mode"),
                @Tag(name = "graph", description = "Knowledge graph and node details (graph-read budget)"),
                @Tag(name = "documents", description = "Paged document list and per-document summaries"),
                @Tag(name = "uploads", description = "Upload admission for the ingestion front end (upload budget)")
        }
)
public class OpenApiConfig {
}
