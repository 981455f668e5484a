package com.specforge.orchestrator.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.specforge.orchestrator.model.StaticAnalysisReport;
import com.specforge.orchestrator.model.StaticAnalysisReport.Severity;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysisReportReaderTest {

    private final ObjectMapper json = new ObjectMapper();

    @Test
    void read_camelCaseReport_mapsAllFields() throws Exception {
        JsonNode node = json.readTree("""
                {"qualityScore": 62,
                 "issues": [{"severity": "HIGH", "location": "line 4",
                             "message": "unused variable", "suggestion": "remove it"}],
                 "recommendations": ["add tests"]}
                """);

        StaticAnalysisReport report = AnalysisReportReader.read(node).orElseThrow();

        assertThat(report.qualityScore()).isEqualTo(62);
        assertThat(report.issues()).hasSize(1);
        assertThat(report.issues().get(0).severity()).isEqualTo(Severity.HIGH);
        assertThat(report.issues().get(0).location()).isEqualTo("line 4");
        assertThat(report.issues().get(0).suggestion()).isEqualTo("remove it");
        assertThat(report.recommendations()).containsExactly("add tests");
    }

    @Test
    void read_snakeCaseScoreAndStringIssues_accepted() throws Exception {
        JsonNode node = json.readTree("{\"quality_score\": \"91\", \"issues\": [\"missing docstring\"]}");

        StaticAnalysisReport report = AnalysisReportReader.read(node).orElseThrow();

        assertThat(report.qualityScore()).isEqualTo(91);
        assertThat(report.issues().get(0).severity()).isEqualTo(Severity.MEDIUM);
        assertThat(report.issues().get(0).message()).isEqualTo("missing docstring");
    }

    @Test
    void read_scoreOutOfRange_isClamped() throws Exception {
        JsonNode node = json.readTree("{\"score\": 140, \"issues\": []}");
        assertThat(AnalysisReportReader.read(node).orElseThrow().qualityScore()).isEqualTo(100);
    }

    @Test
    void read_unrelatedObject_returnsEmpty() throws Exception {
        Optional<StaticAnalysisReport> report = AnalysisReportReader.read(json.readTree("{\"files\": 3}"));
        assertThat(report).isEmpty();
    }

    @Test
    void read_issuesNotAnArray_returnsEmpty() throws Exception {
        assertThat(AnalysisReportReader.read(json.readTree("{\"issues\": \"none\"}"))).isEmpty();
    }

    @Test
    void severity_commonToolVocabulary_mapped() {
        assertThat(AnalysisReportReader.severity("critical")).isEqualTo(Severity.HIGH);
        assertThat(AnalysisReportReader.severity(" Error ")).isEqualTo(Severity.HIGH);
        assertThat(AnalysisReportReader.severity("style")).isEqualTo(Severity.LOW);
        assertThat(AnalysisReportReader.severity("warning")).isEqualTo(Severity.MEDIUM);
        assertThat(AnalysisReportReader.severity("")).isEqualTo(Severity.MEDIUM);
    }
}
