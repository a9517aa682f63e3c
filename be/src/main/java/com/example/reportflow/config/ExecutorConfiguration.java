package com.example.reportflow.config;

import com.example.reportflow.executor.GraphExecutor;
import com.example.reportflow.executor.PipelineExecutor;
import com.example.reportflow.registry.BuiltInNodes;
import com.example.reportflow.registry.DefaultNodeRegistry;
import com.example.reportflow.registry.NodeRegistrar;
import com.example.reportflow.registry.NodeRegistry;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties({ExecutorProperties.class, TemplateProperties.class})
@Slf4j
public class ExecutorConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public BuiltInNodes builtInNodes(Clock clock) {
        return new BuiltInNodes(clock);
    }

    @Bean
    public NodeRegistry nodeRegistry(ObjectProvider<NodeRegistrar> registrars) {
        NodeRegistry registry = new DefaultNodeRegistry();
        registrars.orderedStream().forEach(registrar -> registrar.registerNodes(registry));
        log.info("Node registry ready types={}", registry.registeredTypes());
        return registry;
    }

    @Bean
    public PipelineExecutor pipelineExecutor(NodeRegistry nodeRegistry) {
        return new PipelineExecutor(nodeRegistry);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService graphWorkers(ExecutorProperties properties) {
        int parallelism = Math.max(properties.getParallelism(), 1);
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "graph-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(parallelism, threadFactory);
    }

    @Bean
    public GraphExecutor graphExecutor(NodeRegistry nodeRegistry, ExecutorProperties properties, ExecutorService graphWorkers) {
        if (properties.getParallelism() > 1) {
            log.info("Graph executor runs ready sets on {} worker threads", properties.getParallelism());
            return new GraphExecutor(nodeRegistry, graphWorkers);
        }
        return new GraphExecutor(nodeRegistry);
    }
}
