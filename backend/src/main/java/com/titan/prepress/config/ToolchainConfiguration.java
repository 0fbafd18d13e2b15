package com.titan.prepress.config;

import com.titan.prepress.storage.JobPaths;
import com.titan.prepress.storage.LocalJobStorage;
import com.titan.prepress.toolchain.FontInspector;
import com.titan.prepress.toolchain.FormatNormalizer;
import com.titan.prepress.toolchain.PdfMetadataExtractor;
import com.titan.prepress.toolchain.PdfRepairer;
import com.titan.prepress.toolchain.ProcessToolRunner;
import com.titan.prepress.toolchain.ProofRenderer;
import com.titan.prepress.toolchain.StructureValidator;
import com.titan.prepress.toolchain.ToolDetector;
import com.titan.prepress.toolchain.ToolRunner;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executor;

@Configuration
public class ToolchainConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public LocalJobStorage localJobStorage(PrepressProperties properties) {
        return new LocalJobStorage(new JobPaths(properties.getStorage().tempRoot()));
    }

    @Bean
    public ToolRunner toolRunner(PrepressProperties properties) {
        PrepressProperties.Tools tools = properties.getTools();
        return new ProcessToolRunner(tools.getTimeoutMs(), tools.getMaxOutputBytes(), tools.getBinaries());
    }

    @Bean
    public ToolDetector toolDetector(ToolRunner toolRunner, PrepressProperties properties,
                                     @Qualifier("applicationTaskExecutor") Executor executor) {
        return new ToolDetector(toolRunner, properties.getTools().getProbeTimeoutMs(), executor);
    }

    @Bean
    public FormatNormalizer formatNormalizer(ToolRunner toolRunner) {
        return new FormatNormalizer(toolRunner);
    }

    @Bean
    public StructureValidator structureValidator(ToolRunner toolRunner) {
        return new StructureValidator(toolRunner);
    }

    @Bean
    public PdfMetadataExtractor pdfMetadataExtractor(ToolRunner toolRunner) {
        return new PdfMetadataExtractor(toolRunner);
    }

    @Bean
    public FontInspector fontInspector(ToolRunner toolRunner) {
        return new FontInspector(toolRunner);
    }

    @Bean
    public ProofRenderer proofRenderer(ToolRunner toolRunner) {
        return new ProofRenderer(toolRunner);
    }

    @Bean
    public PdfRepairer pdfRepairer(ToolRunner toolRunner) {
        return new PdfRepairer(toolRunner);
    }
}
