package com.bko.planner.config;

import com.bko.planner.graph.TaskType;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "planner")
public class PlannerProperties {

    private boolean strictMode = false;
    private String registryLocation = "archetype-registry.json";
    private GenerationConfig generation = new GenerationConfig();
    private QualityConfig quality = new QualityConfig();
    private ValidationConfig validation = new ValidationConfig();
    private RefinementConfig refinement = new RefinementConfig();
    private StorageConfig storage = new StorageConfig();

    public boolean isStrictMode() {
        return strictMode;
    }

    public void setStrictMode(boolean strictMode) {
        this.strictMode = strictMode;
    }

    public String getRegistryLocation() {
        return registryLocation;
    }

    public void setRegistryLocation(String registryLocation) {
        this.registryLocation = registryLocation;
    }

    public GenerationConfig getGeneration() {
        return generation;
    }

    public void setGeneration(GenerationConfig generation) {
        this.generation = generation != null ? generation : new GenerationConfig();
    }

    public QualityConfig getQuality() {
        return quality;
    }

    public void setQuality(QualityConfig quality) {
        this.quality = quality != null ? quality : new QualityConfig();
    }

    public ValidationConfig getValidation() {
        return validation;
    }

    public void setValidation(ValidationConfig validation) {
        this.validation = validation != null ? validation : new ValidationConfig();
    }

    public RefinementConfig getRefinement() {
        return refinement;
    }

    public void setRefinement(RefinementConfig refinement) {
        this.refinement = refinement != null ? refinement : new RefinementConfig();
    }

    public StorageConfig getStorage() {
        return storage;
    }

    public void setStorage(StorageConfig storage) {
        this.storage = storage != null ? storage : new StorageConfig();
    }

    public static class GenerationConfig {
        private String defaultModel = "gpt-4o-mini";
        private Duration timeout = Duration.ofSeconds(90);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private int concurrency = 4;
        private Map<String, TaskModelConfig> tasks = new HashMap<>();

        public String getDefaultModel() { return defaultModel; }
        public void setDefaultModel(String defaultModel) { this.defaultModel = defaultModel; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = concurrency; }
        public Map<String, TaskModelConfig> getTasks() { return tasks; }

        public void setTasks(Map<String, TaskModelConfig> tasks) {
            if (tasks == null) {
                return;
            }
            this.tasks = new HashMap<>(tasks);
        }

        /**
         * Resolves the model settings for a task type, falling back to the type's built-in
         * temperature and token budget where no override is configured.
         */
        public TaskModelConfig getTaskConfig(TaskType type) {
            TaskModelConfig override = tasks.get(type.key());
            String model = override != null && override.getModel() != null ? override.getModel() : defaultModel;
            double temperature = override != null && override.getTemperature() != null
                    ? override.getTemperature()
                    : type.defaultTemperature();
            int maxTokens = override != null && override.getMaxTokens() != null
                    ? override.getMaxTokens()
                    : type.defaultMaxTokens();
            return new TaskModelConfig(model, temperature, maxTokens);
        }
    }

    public static class TaskModelConfig {
        private String model;
        private Double temperature;
        private Integer maxTokens;

        public TaskModelConfig() {}

        public TaskModelConfig(String model, Double temperature, Integer maxTokens) {
            this.model = model;
            this.temperature = temperature;
            this.maxTokens = maxTokens;
        }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public Double getTemperature() { return temperature; }
        public void setTemperature(Double temperature) { this.temperature = temperature; }
        public Integer getMaxTokens() { return maxTokens; }
        public void setMaxTokens(Integer maxTokens) { this.maxTokens = maxTokens; }
    }

    public static class Band {
        private int min;
        private int max;

        public Band() {}

        public Band(int min, int max) {
            this.min = min;
            this.max = max;
        }

        public boolean contains(int value) {
            return value >= min && value <= max;
        }

        public int getMin() { return min; }
        public void setMin(int min) { this.min = min; }
        public int getMax() { return max; }
        public void setMax(int max) { this.max = max; }
    }

    public static class ParsimonyBands {
        private Band target;
        private Band near;
        private Band wide;

        public ParsimonyBands() {}

        public ParsimonyBands(Band target, Band near, Band wide) {
            this.target = target;
            this.near = near;
            this.wide = wide;
        }

        public Band getTarget() { return target; }
        public void setTarget(Band target) { this.target = target; }
        public Band getNear() { return near; }
        public void setNear(Band near) { this.near = near; }
        public Band getWide() { return wide; }
        public void setWide(Band wide) { this.wide = wide; }
    }

    public static class GateConfig {
        private double clinicalAccuracy = 0.85;
        private double dataFeasibility = 0.70;
        private double parsimony = 0.70;
        private double overallFast = 0.75;
        private double overallResearch = 0.85;
        private double researchCoverage = 0.75;
        private double specCompliance = 0.90;

        public double getClinicalAccuracy() { return clinicalAccuracy; }
        public void setClinicalAccuracy(double clinicalAccuracy) { this.clinicalAccuracy = clinicalAccuracy; }
        public double getDataFeasibility() { return dataFeasibility; }
        public void setDataFeasibility(double dataFeasibility) { this.dataFeasibility = dataFeasibility; }
        public double getParsimony() { return parsimony; }
        public void setParsimony(double parsimony) { this.parsimony = parsimony; }
        public double getOverallFast() { return overallFast; }
        public void setOverallFast(double overallFast) { this.overallFast = overallFast; }
        public double getOverallResearch() { return overallResearch; }
        public void setOverallResearch(double overallResearch) { this.overallResearch = overallResearch; }
        public double getResearchCoverage() { return researchCoverage; }
        public void setResearchCoverage(double researchCoverage) { this.researchCoverage = researchCoverage; }
        public double getSpecCompliance() { return specCompliance; }
        public void setSpecCompliance(double specCompliance) { this.specCompliance = specCompliance; }
    }

    public static class QualityConfig {
        private ParsimonyBands signalBands = new ParsimonyBands(new Band(15, 25), new Band(10, 30), new Band(5, 40));
        private ParsimonyBands questionBands = new ParsimonyBands(new Band(3, 7), new Band(2, 10), new Band(0, 15));
        private GateConfig gates = new GateConfig();
        private Map<String, Double> fastWeights = new LinkedHashMap<>(Map.of(
                "clinical_accuracy", 0.35,
                "data_feasibility", 0.25,
                "parsimony", 0.20,
                "completeness", 0.20));
        private Map<String, Double> researchWeights = new LinkedHashMap<>(Map.of(
                "spec_compliance", 0.30,
                "clinical_accuracy", 0.25,
                "research_coverage", 0.15,
                "data_feasibility", 0.15,
                "parsimony", 0.10,
                "completeness", 0.05));

        public ParsimonyBands getSignalBands() { return signalBands; }
        public void setSignalBands(ParsimonyBands signalBands) { this.signalBands = signalBands; }
        public ParsimonyBands getQuestionBands() { return questionBands; }
        public void setQuestionBands(ParsimonyBands questionBands) { this.questionBands = questionBands; }
        public GateConfig getGates() { return gates; }
        public void setGates(GateConfig gates) { this.gates = gates != null ? gates : new GateConfig(); }
        public Map<String, Double> getFastWeights() { return fastWeights; }
        public Map<String, Double> getResearchWeights() { return researchWeights; }

        public void setFastWeights(Map<String, Double> fastWeights) {
            if (fastWeights == null || fastWeights.isEmpty()) {
                return;
            }
            this.fastWeights = new LinkedHashMap<>(fastWeights);
        }

        public void setResearchWeights(Map<String, Double> researchWeights) {
            if (researchWeights == null || researchWeights.isEmpty()) {
                return;
            }
            this.researchWeights = new LinkedHashMap<>(researchWeights);
        }
    }

    public static class ValidationConfig {
        private double qualityThreshold = 0.70;

        public double getQualityThreshold() { return qualityThreshold; }
        public void setQualityThreshold(double qualityThreshold) { this.qualityThreshold = qualityThreshold; }
    }

    public static class RefinementConfig {
        private int maxIterations = 10;
        private int noImproveLimit = 3;
        private double regressionDelta = -0.02;
        private boolean strictScoring = false;

        public int getMaxIterations() { return maxIterations; }
        public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }
        public int getNoImproveLimit() { return noImproveLimit; }
        public void setNoImproveLimit(int noImproveLimit) { this.noImproveLimit = noImproveLimit; }
        public double getRegressionDelta() { return regressionDelta; }
        public void setRegressionDelta(double regressionDelta) { this.regressionDelta = regressionDelta; }
        public boolean isStrictScoring() { return strictScoring; }
        public void setStrictScoring(boolean strictScoring) { this.strictScoring = strictScoring; }
    }

    public static class StorageConfig {
        private String outputDir;

        public String getOutputDir() { return outputDir; }
        public void setOutputDir(String outputDir) { this.outputDir = outputDir; }
    }
}
