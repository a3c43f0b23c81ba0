package com.example.snapshotcompare.application;

import com.example.snapshotcompare.domain.MalformedSnapshotException;
import com.example.snapshotcompare.domain.SnapshotNode;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class TabularSnapshotLoaderTest {

    private final TabularSnapshotLoader loader = new TabularSnapshotLoader(new CsvMapper());

    @Test
    void groupsRowsByComponentAsText() throws Exception {
        SnapshotNode node =
                load(
                        """
                        Component,Property,Value
                        CPU,cores,4
                        CPU,model,Ryzen 7
                        OS,system,Linux
                        """);

        SnapshotNode.Tree root = (SnapshotNode.Tree) node;
        assertThat(root.entries()).containsOnlyKeys("CPU", "OS");
        SnapshotNode.Tree cpu = (SnapshotNode.Tree) root.get("CPU");
        assertEquals(SnapshotNode.text("4"), cpu.get("cores"));
        assertEquals(SnapshotNode.text("Ryzen 7"), cpu.get("model"));
        assertThat(cpu.entries().keySet()).containsExactly("cores", "model");
    }

    @Test
    void metricLayoutIgnoresUnitColumn() throws Exception {
        SnapshotNode.Tree root =
                (SnapshotNode.Tree)
                        load(
                                """
                                Component,Metric,Value,Unit
                                RAM,total,16000,MB
                                RAM,percent,41.5,%
                                """);

        SnapshotNode.Tree ram = (SnapshotNode.Tree) root.get("RAM");
        assertThat(ram.entries()).containsOnlyKeys("total", "percent");
        assertEquals(SnapshotNode.text("41.5"), ram.get("percent"));
    }

    @Test
    void headerMatchingIgnoresCaseAndBlanks() throws Exception {
        SnapshotNode.Tree root = (SnapshotNode.Tree) load("component, sensor ,value\nSensor,cpu_temp,55\n");

        assertEquals(SnapshotNode.text("55"), ((SnapshotNode.Tree) root.get("Sensor")).get("cpu_temp"));
    }

    @Test
    void extraCellsAreIgnored() throws Exception {
        SnapshotNode.Tree root = (SnapshotNode.Tree) load("Component,Property,Value\nCPU,cores,4,surplus\n");

        assertEquals(SnapshotNode.text("4"), ((SnapshotNode.Tree) root.get("CPU")).get("cores"));
    }

    @Test
    void missingValueCellBecomesEmptyText() throws Exception {
        SnapshotNode.Tree root = (SnapshotNode.Tree) load("Component,Property,Value\nGPU,driver,\n");

        assertEquals(SnapshotNode.text(""), ((SnapshotNode.Tree) root.get("GPU")).get("driver"));
    }

    @Test
    void rowWithoutComponentIsMalformed() {
        assertThatThrownBy(() -> load("Component,Property,Value\nCPU,cores,4\n,threads,8\n"))
                .isInstanceOf(MalformedSnapshotException.class)
                .hasMessageContaining("line 3")
                .hasMessageContaining("Component");
    }

    @Test
    void rowWithoutPropertyIsMalformed() {
        assertThatThrownBy(() -> load("Component,Property,Value\nCPU\n"))
                .isInstanceOf(MalformedSnapshotException.class)
                .hasMessageContaining("Property");
    }

    @Test
    void componentWithoutPropertyColumnIsMalformed() {
        assertThatThrownBy(() -> load("Component,Value\nCPU,4\n"))
                .isInstanceOf(MalformedSnapshotException.class)
                .hasMessageContaining("Component column");
    }

    @Test
    void emptyContentIsMalformed() {
        assertThatThrownBy(() -> load(""))
                .isInstanceOf(MalformedSnapshotException.class)
                .hasMessageContaining("header");
    }

    @Test
    void keyValueTableFallsBackToFlatPaths() throws Exception {
        SnapshotNode.Tree root = (SnapshotNode.Tree) load("Key,Value\nCPU.cores,4\nDisk[0].size,500\n");

        assertThat(root.entries()).containsOnlyKeys("CPU.cores", "Disk[0].size");
        assertEquals(SnapshotNode.text("500"), root.get("Disk[0].size"));
    }

    @Test
    void otherTablesFallBackToNumberedRows() throws Exception {
        SnapshotNode.Tree root = (SnapshotNode.Tree) load("pid,name,cpu\n1,init,0.1\n42,java,12.5\n");

        assertThat(root.entries()).containsOnlyKeys("row_0", "row_1");
        SnapshotNode.Tree second = (SnapshotNode.Tree) root.get("row_1");
        assertEquals(SnapshotNode.text("java"), second.get("name"));
        assertEquals(SnapshotNode.text("12.5"), second.get("cpu"));
    }

    @Test
    void structuredTierDeclinesTablesWithoutComponent() throws Exception {
        TabularTable table = new TabularTable(List.of("Key", "Value"), List.of(Map.of("Key", "a", "Value", "1")));

        assertThat(new StructuredTabularLoad().tryLoad(table, "t.csv")).isEmpty();
        assertEquals(
                new SnapshotNode.Tree(Map.of("a", SnapshotNode.text("1"))), new FallbackFlattenLoad().load(table));
    }

    private SnapshotNode load(String csv) throws Exception {
        try (InputStream in = new ByteArrayInputStream(csv.getBytes(StandardCharsets.UTF_8))) {
            return loader.load(in, "snapshot.csv");
        }
    }
}
