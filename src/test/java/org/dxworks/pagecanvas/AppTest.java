package org.dxworks.pagecanvas;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AppTest {

    @TempDir
    Path dir;

    @Test
    void writesOneLinePerPageBetweenRunAndDone() throws Exception {
        Path input = Files.createDirectories(dir.resolve("pages"));
        Files.writeString(input.resolve("good.html"), "<div>" + TestUtils.textFragment("t", 1, 1, "Hi") + "</div>");
        Files.writeString(input.resolve("bad.aspx"),
                "<div><div data-sp-canvascontrol=\"\" data-sp-controldata=\"oops\"></div></div>");
        Files.writeString(input.resolve("notes.txt"), "ignored");
        Path output = dir.resolve("out/result.jsonl");

        App.main(new String[]{input.toString(), output.toString()});

        ObjectMapper mapper = new ObjectMapper();
        List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
        assertEquals(4, lines.size());

        JsonNode run = mapper.readTree(lines.get(0));
        assertEquals("run", run.get("kind").asText());
        assertEquals(2, run.get("total_files").asInt());

        JsonNode page = null;
        JsonNode error = null;
        for (String line : lines.subList(1, 3)) {
            JsonNode node = mapper.readTree(line);
            if ("page".equals(node.get("kind").asText())) {
                page = node;
            } else {
                error = node;
            }
        }
        assertNotNull(page);
        assertEquals(1, page.get("controlCount").asInt());
        assertNotNull(error);
        assertEquals("error", error.get("kind").asText());
        assertEquals("CodecException", error.get("error_type").asText());

        JsonNode done = mapper.readTree(lines.get(3));
        assertEquals("done", done.get("kind").asText());
        assertEquals(1, done.get("pages_parsed").asInt());
        assertEquals(1, done.get("pages_with_errors").asInt());
    }

    @Test
    void collectsOnlyConfiguredExtensions() throws Exception {
        Files.writeString(dir.resolve("a.HTML"), "<div></div>");
        Files.writeString(dir.resolve("b.json"), "{}");

        List<Path> files = App.collectMarkupFiles(dir, PageCanvasConfig.defaults());

        assertEquals(List.of(dir.resolve("a.HTML")), files);
    }
}
