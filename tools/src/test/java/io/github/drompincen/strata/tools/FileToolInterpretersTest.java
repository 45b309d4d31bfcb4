package io.github.drompincen.strata.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.strata.protocol.api.DiffLine;
import io.github.drompincen.strata.protocol.api.ToolActivity;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FileToolInterpretersTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ToolInterpreterRegistry registry = ToolInterpreterRegistry.loadDefault();

    private ToolActivity interpret(String tool, String input, String result) throws Exception {
        return registry.interpret(tool, mapper.readTree(input), mapper.readTree(result));
    }

    @Test
    void longBashCommandIsTruncated() throws Exception {
        String command = "x".repeat(100);

        ToolActivity activity = interpret("Bash", "{\"command\":\"" + command + "\"}", "{}");

        assertThat(activity.summary()).hasSize(80).endsWith("...").startsWith("xxx");
    }

    @Test
    void bashCommandOfEightyCharsIsKept() throws Exception {
        String command = "y".repeat(80);

        assertThat(interpret("Bash", "{\"command\":\"" + command + "\"}", "{}").summary()).isEqualTo(command);
    }

    @Test
    void interruptedBashReportsDetail() throws Exception {
        ToolActivity activity = interpret("Bash", "{\"command\":\"sleep 9\"}",
                "{\"stdout\":\"\",\"stderr\":\"killed\",\"interrupted\":true}");

        assertThat(activity.output().interrupted()).isTrue();
        assertThat(activity.output().stderr()).isEqualTo("killed");
        assertThat(activity.detail()).isEqualTo("Interrupted");
    }

    @Test
    void editProducesDiffAndCounts() throws Exception {
        ToolActivity activity = interpret("Edit",
                "{\"file_path\":\"/repo/src/Main.java\"}",
                "{\"oldString\":\"a\\nb\",\"newString\":\"c\"}");

        assertThat(activity.summary()).isEqualTo("Edit Main.java");
        assertThat(activity.output().diffLines()).containsExactly(
                new DiffLine(DiffLine.Kind.REMOVAL, "a", 1),
                new DiffLine(DiffLine.Kind.REMOVAL, "b", 2),
                new DiffLine(DiffLine.Kind.ADDITION, "c", 1));
        assertThat(activity.detail()).isEqualTo("1 added, 2 removed");
    }

    @Test
    void editFallsBackToRequestStrings() throws Exception {
        ToolActivity activity = interpret("Edit",
                "{\"file_path\":\"a.txt\",\"old_string\":\"\",\"new_string\":\"new\"}",
                "{\"filePath\":\"a.txt\"}");

        assertThat(activity.output().diffLines()).containsExactly(new DiffLine(DiffLine.Kind.ADDITION, "new", 1));
        assertThat(activity.detail()).isEqualTo("1 added");
    }

    @Test
    void readTakesNestedFileContent() throws Exception {
        assertThat(interpret("Read", "{\"file_path\":\"/a/b.txt\"}", "{\"file\":{\"content\":\"hi\"}}")
                .output().fileContent()).isEqualTo("hi");
        ToolActivity flat = interpret("Read", "{\"file_path\":\"/a/b.txt\"}", "{\"content\":\"flat\"}");
        assertThat(flat.output().fileContent()).isEqualTo("flat");
        assertThat(flat.summary()).isEqualTo("Read b.txt");
    }

    @Test
    void writeKeepsNothingButSummary() throws Exception {
        ToolActivity activity = interpret("Write", "{\"file_path\":\"out/x.md\",\"content\":\"# x\"}",
                "{\"type\":\"create\"}");

        assertThat(activity.output().raw()).isNull();
        assertThat(activity.output().fileContent()).isNull();
        assertThat(activity.summary()).isEqualTo("Write x.md");
    }

    @Test
    void globAndGrepListFiles() throws Exception {
        ToolActivity glob = interpret("Glob", "{\"pattern\":\"**/*.java\"}",
                "{\"filenames\":[\"A.java\",\"B.java\"],\"numFiles\":2}");
        assertThat(glob.output().filenames()).containsExactly("A.java", "B.java");
        assertThat(glob.summary()).isEqualTo("Search **/*.java (2 files)");

        ToolActivity grep = interpret("Grep", "{\"pattern\":\"TODO\"}", "{\"filenames\":[\"A.java\"],\"numFiles\":1}");
        assertThat(grep.summary()).isEqualTo("Grep /TODO/ (1 match)");
    }
}
