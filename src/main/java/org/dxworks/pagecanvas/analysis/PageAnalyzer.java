package org.dxworks.pagecanvas.analysis;

import org.dxworks.pagecanvas.PageCanvasConfig;
import org.dxworks.pagecanvas.model.CanvasColumn;
import org.dxworks.pagecanvas.model.CanvasControl;
import org.dxworks.pagecanvas.model.CanvasSection;
import org.dxworks.pagecanvas.model.ClientSideText;
import org.dxworks.pagecanvas.model.ClientSideWebPart;
import org.dxworks.pagecanvas.page.ClientSidePage;

import java.util.List;
import java.util.Objects;

/**
 * Parses canvas markup and summarizes the resulting tree. Orders in the summary are list
 * positions, i.e. the values the page would carry after rendering.
 */
public class PageAnalyzer {

    private final PageCanvasConfig config;

    public PageAnalyzer(PageCanvasConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public PageAnalysis analyze(String filePath, String markup) {
        ClientSidePage page = new ClientSidePage(config).fromHtml(markup);

        PageAnalysis analysis = new PageAnalysis();
        analysis.filePath = filePath;

        List<CanvasSection> sections = page.getSections();
        for (int s = 0; s < sections.size(); s++) {
            SectionSummary section = new SectionSummary();
            section.order = s + 1;

            List<CanvasColumn> columns = sections.get(s).getColumns();
            for (int c = 0; c < columns.size(); c++) {
                CanvasColumn column = columns.get(c);
                ColumnSummary columnSummary = new ColumnSummary();
                columnSummary.order = c + 1;
                columnSummary.factor = column.getFactor().getValue();

                List<CanvasControl> controls = column.getControls();
                for (int i = 0; i < controls.size(); i++) {
                    columnSummary.controls.add(summarize(controls.get(i), i + 1));
                }
                analysis.controlCount += controls.size();
                section.columns.add(columnSummary);
            }
            analysis.sections.add(section);
        }

        return analysis;
    }

    private static ControlSummary summarize(CanvasControl control, int order) {
        ControlSummary summary = new ControlSummary();
        summary.type = control.getControlType().name();
        summary.order = order;
        summary.id = control.getId();

        if (control instanceof ClientSideText text) {
            summary.text = text.getText();
        } else if (control instanceof ClientSideWebPart webPart) {
            summary.webPartId = webPart.getWebPartId();
            summary.title = webPart.getTitle();
        }
        return summary;
    }
}
