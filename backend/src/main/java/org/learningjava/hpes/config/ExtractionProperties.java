package org.learningjava.hpes.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunables of the extraction engine ({@code hpes.extraction.*}). The defaults are
 * the values used when nothing is configured, so services can also be built with
 * {@code new ExtractionProperties()} outside a Spring context.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "hpes.extraction")
public class ExtractionProperties {

    @NotEmpty
    private List<String> documentExtensions = new ArrayList<>(
            List.of("md", "markdown", "txt", "text", "rst", "adoc", "docx", "pdf"));

    @Valid
    private Segmentation segmentation = new Segmentation();
    @Valid
    private Validation validation = new Validation();
    @Valid
    private Fallback fallback = new Fallback();
    @Valid
    private Scoring scoring = new Scoring();
    @Valid
    private Batch batch = new Batch();
    @Valid
    private Normalize normalize = new Normalize();

    public List<String> getDocumentExtensions() { return documentExtensions; }
    public void setDocumentExtensions(List<String> v) { this.documentExtensions = v; }
    public Segmentation getSegmentation() { return segmentation; }
    public void setSegmentation(Segmentation v) { this.segmentation = v; }
    public Validation getValidation() { return validation; }
    public void setValidation(Validation v) { this.validation = v; }
    public Fallback getFallback() { return fallback; }
    public void setFallback(Fallback v) { this.fallback = v; }
    public Scoring getScoring() { return scoring; }
    public void setScoring(Scoring v) { this.scoring = v; }
    public Batch getBatch() { return batch; }
    public void setBatch(Batch v) { this.batch = v; }
    public Normalize getNormalize() { return normalize; }
    public void setNormalize(Normalize v) { this.normalize = v; }

    public static class Segmentation {
        @Min(1)
        private int minBlockLines = 3;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double densityThreshold = 0.15;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double strongDensity = 0.30;
        @Min(0)
        private int indentComplexity = 2;
        @Min(0)
        private int densityComplexity = 3;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double maxProseRatio = 0.20;
        @Min(0)
        private int maxSentences = 2;

        public int getMinBlockLines() { return minBlockLines; }
        public void setMinBlockLines(int v) { this.minBlockLines = v; }
        public double getDensityThreshold() { return densityThreshold; }
        public void setDensityThreshold(double v) { this.densityThreshold = v; }
        public double getStrongDensity() { return strongDensity; }
        public void setStrongDensity(double v) { this.strongDensity = v; }
        public int getIndentComplexity() { return indentComplexity; }
        public void setIndentComplexity(int v) { this.indentComplexity = v; }
        public int getDensityComplexity() { return densityComplexity; }
        public void setDensityComplexity(int v) { this.densityComplexity = v; }
        public double getMaxProseRatio() { return maxProseRatio; }
        public void setMaxProseRatio(double v) { this.maxProseRatio = v; }
        public int getMaxSentences() { return maxSentences; }
        public void setMaxSentences(int v) { this.maxSentences = v; }
    }

    public static class Validation {
        @Min(0)
        private int topK = 3;
        @NotNull
        private Duration regionTimeout = Duration.ofSeconds(2);
        @Min(1)
        private int parallelism = 4;
        @Min(1)
        private int parserThreads = 8;
        @Min(1)
        private int maxRegionChars = 200_000;

        public int getTopK() { return topK; }
        public void setTopK(int v) { this.topK = v; }
        public Duration getRegionTimeout() { return regionTimeout; }
        public void setRegionTimeout(Duration v) { this.regionTimeout = v; }
        public int getParallelism() { return parallelism; }
        public void setParallelism(int v) { this.parallelism = v; }
        public int getParserThreads() { return parserThreads; }
        public void setParserThreads(int v) { this.parserThreads = v; }
        public int getMaxRegionChars() { return maxRegionChars; }
        public void setMaxRegionChars(int v) { this.maxRegionChars = v; }
    }

    public static class Fallback {
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double minRuleScore = 0.3;

        public double getMinRuleScore() { return minRuleScore; }
        public void setMinRuleScore(double v) { this.minRuleScore = v; }
    }

    public static class Scoring {
        private double astBase = 0.85;
        private double astFloor = 0.75;
        private double astStructuralMax = 0.10;
        private int nodeSaturation = 400;
        private double fallbackBase = 0.40;
        private double fallbackCeiling = 0.70;
        private double fallbackStructuralMax = 0.25;
        private double unknownBase = 0.10;
        private double unknownCeiling = 0.20;
        private int shortRegionLines = 3;
        private double shortPenaltyMax = 0.15;
        private double largeFraction = 0.9;
        private double largePenalty = 0.10;

        public double getAstBase() { return astBase; }
        public void setAstBase(double v) { this.astBase = v; }
        public double getAstFloor() { return astFloor; }
        public void setAstFloor(double v) { this.astFloor = v; }
        public double getAstStructuralMax() { return astStructuralMax; }
        public void setAstStructuralMax(double v) { this.astStructuralMax = v; }
        public int getNodeSaturation() { return nodeSaturation; }
        public void setNodeSaturation(int v) { this.nodeSaturation = v; }
        public double getFallbackBase() { return fallbackBase; }
        public void setFallbackBase(double v) { this.fallbackBase = v; }
        public double getFallbackCeiling() { return fallbackCeiling; }
        public void setFallbackCeiling(double v) { this.fallbackCeiling = v; }
        public double getFallbackStructuralMax() { return fallbackStructuralMax; }
        public void setFallbackStructuralMax(double v) { this.fallbackStructuralMax = v; }
        public double getUnknownBase() { return unknownBase; }
        public void setUnknownBase(double v) { this.unknownBase = v; }
        public double getUnknownCeiling() { return unknownCeiling; }
        public void setUnknownCeiling(double v) { this.unknownCeiling = v; }
        public int getShortRegionLines() { return shortRegionLines; }
        public void setShortRegionLines(int v) { this.shortRegionLines = v; }
        public double getShortPenaltyMax() { return shortPenaltyMax; }
        public void setShortPenaltyMax(double v) { this.shortPenaltyMax = v; }
        public double getLargeFraction() { return largeFraction; }
        public void setLargeFraction(double v) { this.largeFraction = v; }
        public double getLargePenalty() { return largePenalty; }
        public void setLargePenalty(double v) { this.largePenalty = v; }
    }

    public static class Batch {
        @Min(1)
        private int concurrency = 4;
        @NotNull
        private Duration timeout = Duration.ofMinutes(5);
        @Min(1)
        private int maxRunning = 2;
        // finished batches kept for status lookups
        @Min(0)
        private int retainFinished = 100;

        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int v) { this.concurrency = v; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration v) { this.timeout = v; }
        public int getMaxRunning() { return maxRunning; }
        public void setMaxRunning(int v) { this.maxRunning = v; }
        public int getRetainFinished() { return retainFinished; }
        public void setRetainFinished(int v) { this.retainFinished = v; }
    }

    public static class Normalize {
        @Min(1)
        private long maxInputBytes = 50L * 1024 * 1024;

        public long getMaxInputBytes() { return maxInputBytes; }
        public void setMaxInputBytes(long v) { this.maxInputBytes = v; }
    }
}
