package org.carball.logquery.cli;

import lombok.Data;
import org.carball.logquery.builder.HistogramInterval;
import org.carball.logquery.model.query.SortOptions;
import org.carball.logquery.model.request.QueryMode;

import java.nio.file.Path;
import java.time.Instant;

@Data
public class CliArguments {
    private String table;
    private QueryMode mode;
    private String queryText;
    private Path filtersFile;
    private Instant from;
    private Instant to;
    private Long limit;
    private SortOptions sort;
    private String configPath;

    // Set when --histogram is given; null interval means pick one from the range
    private boolean histogram;
    private HistogramInterval histogramInterval;
}
