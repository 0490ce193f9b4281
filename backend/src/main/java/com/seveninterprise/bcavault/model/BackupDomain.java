package com.seveninterprise.bcavault.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Domínios (tabelas) incluídos em um snapshot, na ordem em que são lidos.
 *
 * A ordem respeita as dependências de chave estrangeira: todo domínio aparece
 * depois dos domínios que ele referencia, para que a restauração possa
 * reinserir os registros na mesma sequência.
 */
public enum BackupDomain {

    USERS("users", "users"),
    COMPANIES("companies", "companies"),
    BUILDING_CODES("buildingCodes", "building_codes"),
    BUILDING_COMPONENTS("buildingComponents", "building_components"),
    DETERIORATION_CURVES("deteriorationCurves", "deterioration_curves", "buildingComponents"),
    PROJECTS("projects", "projects", "users", "companies"),
    BUILDING_SECTIONS("buildingSections", "building_sections", "projects"),
    ASSETS("assets", "assets", "projects", "buildingCodes"),
    ASSESSMENTS("assessments", "assessments", "assets", "projects", "buildingComponents"),
    DEFICIENCIES("deficiencies", "deficiencies", "assessments"),
    PHOTOS("photos", "photos", "assessments", "assets"),
    COST_ESTIMATES("costEstimates", "cost_estimates", "deficiencies"),
    MAINTENANCE_ENTRIES("maintenanceEntries", "maintenance_entries", "assets"),
    PROJECT_DOCUMENTS("projectDocuments", "project_documents", "projects"),
    ASSET_DOCUMENTS("assetDocuments", "asset_documents", "assets"),
    ASSESSMENT_DOCUMENTS("assessmentDocuments", "assessment_documents", "assessments"),
    RISK_ASSESSMENTS("riskAssessments", "risk_assessments", "assets"),
    OPTIMIZATION_SCENARIOS("optimizationScenarios", "optimization_scenarios", "projects"),
    CAPITAL_BUDGET_CYCLES("capitalBudgetCycles", "capital_budget_cycles", "companies"),
    BUDGET_ALLOCATIONS("budgetAllocations", "budget_allocations", "capitalBudgetCycles", "projects"),
    REPORT_TEMPLATES("reportTemplates", "report_templates", "users"),
    REPORT_HISTORY("reportHistory", "report_history", "reportTemplates", "projects"),
    PROJECT_PERMISSIONS("projectPermissions", "project_permissions", "projects", "users"),
    CONVERSATIONS("conversations", "conversations", "users"),
    CUSTOM_COMPONENTS("customComponents", "custom_components", "projects"),
    FACILITY_MODELS("facilityModels", "facility_models", "assets"),
    FLOOR_PLANS("floorPlans", "floor_plans", "projects", "buildingSections"),
    ACCESS_REQUESTS("accessRequests", "access_requests", "companies"),
    AUDIT_LOG("auditLog", "audit_log", "users"),
    PORTFOLIO_METRICS_HISTORY("portfolioMetricsHistory", "portfolio_metrics_history", "companies"),
    FINANCIAL_FORECASTS("financialForecasts", "financial_forecasts", "assets"),
    BENCHMARK_DATA("benchmarkData", "benchmark_data"),
    ECONOMIC_INDICATORS("economicIndicators", "economic_indicators"),
    PORTFOLIO_TARGETS("portfolioTargets", "portfolio_targets", "companies"),
    INVESTMENT_ANALYSIS("investmentAnalysis", "investment_analysis", "assets");

    private final String domainName;
    private final String tableName;
    private final List<String> dependsOn;

    BackupDomain(String domainName, String tableName, String... dependsOn) {
        this.domainName = domainName;
        this.tableName = tableName;
        this.dependsOn = List.of(dependsOn);
    }

    /**
     * Nome lógico usado no payload do snapshot
     */
    public String getDomainName() {
        return domainName;
    }

    public String getTableName() {
        return tableName;
    }

    /**
     * Nomes lógicos dos domínios referenciados por este
     */
    public List<String> getDependsOn() {
        return dependsOn;
    }

    public static Optional<BackupDomain> fromDomainName(String domainName) {
        return Arrays.stream(values())
            .filter(d -> d.domainName.equals(domainName))
            .findFirst();
    }

    /**
     * Domínios na ordem de leitura
     */
    public static List<BackupDomain> inBackupOrder() {
        return List.of(values());
    }
}
