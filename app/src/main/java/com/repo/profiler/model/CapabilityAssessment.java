package com.repo.profiler.model;

/**
 * Success likelihood per project type, each in [0,1].
 */
public record CapabilityAssessment(
        double apiService,
        double cliTool,
        double dataPipeline,
        double mlModel,
        double frontendApp,
        double fullstackApp,
        double infrastructure,
        double pluginSystem) {

    public double scoreFor(ProjectType type) {
        return switch (type) {
            case API_SERVICE -> apiService;
            case CLI_TOOL -> cliTool;
            case DATA_PIPELINE -> dataPipeline;
            case ML_MODEL -> mlModel;
            case FRONTEND_APP -> frontendApp;
            case FULLSTACK_APP -> fullstackApp;
            case INFRASTRUCTURE -> infrastructure;
            case PLUGIN_SYSTEM -> pluginSystem;
        };
    }
}
