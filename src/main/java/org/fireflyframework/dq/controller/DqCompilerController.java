/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.dq.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.dq.definition.CompiledRule;
import org.fireflyframework.dq.definition.CompiledRuleBinding;
import org.fireflyframework.dq.model.CompileApiRequest;
import org.fireflyframework.dq.model.CompileApiResponse;
import org.fireflyframework.dq.model.CompiledBindingSummary;
import org.fireflyframework.dq.service.CompilationRequest;
import org.fireflyframework.dq.service.CompilationResult;
import org.fireflyframework.dq.service.DqCompilationService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST controller exposing data quality compilation.
 *
 * <p><b>Example:</b></p>
 * <pre>
 * POST /api/v1/dq/compile
 * GET  /api/v1/dq/rule-bindings
 * </pre>
 *
 * <p>Configuration errors are translated into 400 responses by
 * {@link org.fireflyframework.dq.controller.advice.DqExceptionHandler}.</p>
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/dq")
@Tag(name = "Data Quality Compiler", description = "Compile data quality rule bindings into validation SQL")
public class DqCompilerController {

    private final DqCompilationService compilationService;

    public DqCompilerController(DqCompilationService compilationService) {
        this.compilationService = compilationService;
    }

    /**
     * Compiles the requested rule bindings.
     *
     * @param request the rule bindings and environment to compile
     * @return the compiled bindings and the summary query
     */
    @PostMapping("/compile")
    @Operation(
        summary = "Compile rule bindings",
        description = "Loads the configured definitions, compiles the requested rule bindings (all when none " +
                     "are given) for the target environment and renders their validation and summary SQL."
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Rule bindings compiled successfully",
            content = @Content(schema = @Schema(implementation = CompileApiResponse.class))
        ),
        @ApiResponse(
            responseCode = "400",
            description = "A definition is invalid or a reference cannot be resolved"
        )
    })
    public Mono<CompileApiResponse> compile(
            @Parameter(description = "Rule binding IDs, environment and invocation ID")
            @RequestBody(required = false) CompileApiRequest request) {
        CompileApiRequest apiRequest = request != null ? request : new CompileApiRequest();
        log.info("Received compile request - ruleBindingIds: {}, environment: {}",
                apiRequest.getRuleBindingIds(), apiRequest.getEnvironment());

        CompilationRequest compilationRequest = CompilationRequest.builder()
                .ruleBindingIds(apiRequest.getRuleBindingIds() != null ? apiRequest.getRuleBindingIds() : List.of())
                .environment(apiRequest.getEnvironment())
                .invocationId(apiRequest.getInvocationId())
                .build();

        return compilationService.compile(compilationRequest).map(this::toResponse);
    }

    /**
     * Lists the loaded rule bindings.
     *
     * @return sorted rule binding ids
     */
    @GetMapping("/rule-bindings")
    @Operation(
        summary = "List rule bindings",
        description = "Returns the IDs of every rule binding in the configured definitions, sorted."
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Rule binding IDs listed successfully"),
        @ApiResponse(responseCode = "400", description = "The configured definitions are invalid")
    })
    public Mono<List<String>> listRuleBindings() {
        log.debug("Listing rule bindings");
        return compilationService.listRuleBindingIds();
    }

    private CompileApiResponse toResponse(CompilationResult result) {
        List<CompiledBindingSummary> bindings = result.getCompiledBindings().stream()
                .map(binding -> toSummary(binding, result))
                .toList();
        return CompileApiResponse.builder()
                .invocationId(result.getInvocationId())
                .environment(result.getEnvironment())
                .ruleBindings(bindings)
                .summarySql(result.getSummarySql())
                .timestamp(result.getTimestamp())
                .build();
    }

    private CompiledBindingSummary toSummary(CompiledRuleBinding binding, CompilationResult result) {
        return CompiledBindingSummary.builder()
                .ruleBindingId(binding.getRuleBindingId())
                .tableId(binding.getTableId())
                .columnId(binding.getColumnId())
                .rowFilterId(binding.getRowFilterId())
                .ruleIds(binding.getRules().stream().map(CompiledRule::getRuleId).toList())
                .incremental(binding.isIncremental())
                .configsHashsum(binding.getConfigsHashsum())
                .sql(result.getRuleBindingSql().get(binding.getRuleBindingId()))
                .build();
    }
}
