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

package org.fireflyframework.dq.config;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.dq.compiler.RuleBindingCompiler;
import org.fireflyframework.dq.controller.DqCompilerController;
import org.fireflyframework.dq.controller.advice.DqExceptionHandler;
import org.fireflyframework.dq.integration.DqSummaryExecutor;
import org.fireflyframework.dq.integration.HighWatermarkProvider;
import org.fireflyframework.dq.integration.MetadataRegistryClient;
import org.fireflyframework.dq.integration.TableMetadataProvider;
import org.fireflyframework.dq.registry.ConfigsLoader;
import org.fireflyframework.dq.resiliency.CollaboratorResiliencyRegistry;
import org.fireflyframework.dq.resolve.EntityUriResolver;
import org.fireflyframework.dq.service.DqCompilationService;
import org.fireflyframework.dq.sql.SqlGenerator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;

/**
 * Auto-configuration for the data quality compiler.
 *
 * <p>This configuration automatically sets up:</p>
 * <ul>
 *   <li>{@link ConfigsLoader}, {@link RuleBindingCompiler} and {@link SqlGenerator}</li>
 *   <li>{@link CollaboratorResiliencyRegistry} guarding every collaborator call</li>
 *   <li>{@link DqCompilationService} when {@code firefly.dq.configs-path} is set, wired with the
 *       {@link TableMetadataProvider}, {@link MetadataRegistryClient}, {@link HighWatermarkProvider}
 *       and {@link DqSummaryExecutor} beans that are available</li>
 *   <li>The REST controller and its exception handler in reactive web applications</li>
 * </ul>
 *
 * <p><b>Example Configuration:</b></p>
 * <pre>{@code
 * firefly:
 *   dq:
 *     enabled: true
 *     configs-path: /etc/dq/configs
 * }</pre>
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(DqCompilerProperties.class)
@ConditionalOnProperty(
    prefix = "firefly.dq",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true
)
public class DqCompilerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ConfigsLoader dqConfigsLoader() {
        return new ConfigsLoader();
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleBindingCompiler dqRuleBindingCompiler() {
        return new RuleBindingCompiler();
    }

    @Bean
    @ConditionalOnMissingBean
    public SqlGenerator dqSqlGenerator() {
        return new SqlGenerator();
    }

    @Bean
    @ConditionalOnMissingBean
    public CollaboratorResiliencyRegistry dqCollaboratorResiliencyRegistry(DqCompilerProperties properties) {
        return new CollaboratorResiliencyRegistry(properties.getResiliency(), properties.getCollaborators());
    }

    @Bean
    @ConditionalOnMissingBean
    public EntityUriResolver dqEntityUriResolver(
            @Autowired(required = false) TableMetadataProvider tableMetadataProvider,
            @Autowired(required = false) MetadataRegistryClient metadataRegistryClient,
            CollaboratorResiliencyRegistry resiliencyRegistry) {
        return new EntityUriResolver(tableMetadataProvider, metadataRegistryClient, resiliencyRegistry);
    }

    /**
     * Creates the compilation service.
     *
     * <p>Definitions are reloaded from {@code firefly.dq.configs-path} on every
     * invocation.</p>
     *
     * @return the configured compilation service
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.dq", name = "configs-path")
    public DqCompilationService dqCompilationService(
            ConfigsLoader configsLoader,
            RuleBindingCompiler compiler,
            SqlGenerator sqlGenerator,
            EntityUriResolver entityUriResolver,
            CollaboratorResiliencyRegistry resiliencyRegistry,
            DqCompilerProperties properties,
            @Autowired(required = false) HighWatermarkProvider highWatermarkProvider,
            @Autowired(required = false) DqSummaryExecutor summaryExecutor,
            @Autowired(required = false) ApplicationEventPublisher eventPublisher) {
        Path configsPath = Path.of(properties.getConfigsPath());
        log.info("Configuring Data Quality Compiler with configs from {} (strategy={}, summaryExecutor={})",
                configsPath, properties.getStrategy(), summaryExecutor != null);
        return new DqCompilationService(
                () -> configsLoader.load(configsPath),
                compiler,
                sqlGenerator,
                entityUriResolver,
                highWatermarkProvider,
                summaryExecutor,
                resiliencyRegistry,
                properties,
                eventPublisher);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(DqCompilationService.class)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
    public DqCompilerController dqCompilerController(DqCompilationService compilationService) {
        return new DqCompilerController(compilationService);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
    public DqExceptionHandler dqExceptionHandler() {
        return new DqExceptionHandler();
    }
}
