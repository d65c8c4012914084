package com.repo.defects.report;

import com.repo.defects.scoring.RankedEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvReporterTest {

    @TempDir
    Path tempDir;

    @Test
    void testWritesOneRowPerEntry() throws IOException {
        List<DefectReport> reports = List.of(
                new DefectReport("change-history", 2, List.of(
                        new RankedEntry("a.py", 0.75, 1),
                        new RankedEntry("dir/with,comma.py", 0.25, 2)), true, List.of()),
                new DefectReport("static-analysis", 2, List.of(), false, List.of()));
        Path output = tempDir.resolve("report.csv");

        new CsvReporter().generate(reports, output);

        List<String> lines = Files.readAllLines(output);
        assertEquals(List.of(
                "Source,Rank,Path,Score,Partial",
                "change-history,1,a.py,0.750000,true",
                "change-history,2,\"dir/with,comma.py\",0.250000,true"), lines);
    }
}
