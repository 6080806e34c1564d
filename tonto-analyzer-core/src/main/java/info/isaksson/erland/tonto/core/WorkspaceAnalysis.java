package info.isaksson.erland.tonto.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/**
 * Results of analyzing every {@code .tonto} file under a directory, in relative path order.
 *
 * <p>Each file is analyzed on its own; names are never resolved across files.</p>
 */
@JsonPropertyOrder({"root", "file_count", "files_with_errors", "summary", "files"})
public final class WorkspaceAnalysis {
    public final String root;
    public final List<AnalysisResult> files;
    public final AnalysisSummary summary;

    WorkspaceAnalysis(String root, List<AnalysisResult> files) {
        this.root = root;
        this.files = files == null ? List.of() : List.copyOf(files);
        List<AnalysisSummary> summaries = new ArrayList<>();
        for (AnalysisResult r : this.files) summaries.add(r.summary);
        this.summary = AnalysisSummary.combine(summaries);
    }

    @JsonProperty("file_count")
    public int fileCount() {
        return files.size();
    }

    @JsonProperty("files_with_errors")
    public int filesWithErrors() {
        int n = 0;
        for (AnalysisResult r : files) {
            if (r.hasErrors()) n++;
        }
        return n;
    }

    public AnalysisResult file(String filename) {
        for (AnalysisResult r : files) {
            if (r.filename.equals(filename)) return r;
        }
        return null;
    }
}
