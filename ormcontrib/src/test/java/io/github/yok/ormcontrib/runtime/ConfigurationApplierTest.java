package io.github.yok.ormcontrib.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import io.github.yok.ormcontrib.config.ConfigurationEnvironment;
import io.github.yok.ormcontrib.config.ConfigurationSection;
import io.github.yok.ormcontrib.runtime.trace.ConsoleTraceListener;
import io.github.yok.ormcontrib.runtime.trace.DebugTraceListener;
import io.github.yok.ormcontrib.runtime.trace.FileTraceListener;
import io.github.yok.ormcontrib.runtime.trace.TraceListener;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.yaml.snakeyaml.Yaml;

class ConfigurationApplierTest {

    @TempDir
    Path tempDir;

    private final RuntimeConfiguration target = new RuntimeConfiguration();

    private static ConfigurationSection parse(String yaml) {
        Map<String, Object> document = new Yaml().load(yaml);
        return ConfigurationSection.root(document);
    }

    @Test
    void configure_正常ケース_トレーススイッチを指定する_レベル設定とDQEへの振り分けが行われること() {
        ConfigurationSection root = parse("LLBLGen:\n"
                + "  Tracing:\n"
                + "    Switches:\n"
                + "      EntityFetch: '2'\n"
                + "      SqlServerDQE: '1'\n"
                + "      BadValue: notanumber\n");

        ConfigurationApplier.configure(target, root);

        TracingConfiguration tracing = target.getTracing();
        assertEquals(TraceLevel.WARNING, tracing.getTraceLevel("EntityFetch"));
        assertEquals(TraceLevel.ERROR, target.getDqe().getTraceLevel());
        assertFalse(tracing.getTraceLevels().containsKey("SqlServerDQE"));
        assertFalse(tracing.getTraceLevels().containsKey("BadValue"));
        assertTrue(tracing.isTraceEnabled());
    }

    @Test
    void configure_正常ケース_スイッチがすべて0_トレースが有効化されないこと() {
        ConfigurationSection root =
                parse("LLBLGen:\n  Tracing:\n    Switches:\n      EntityFetch: 0\n");

        ConfigurationApplier.configure(target, root);

        assertEquals(TraceLevel.OFF, target.getTracing().getTraceLevel("EntityFetch"));
        assertTrue(target.getTracing().getTraceLevels().containsKey("EntityFetch"));
        assertFalse(target.getTracing().isTraceEnabled());
    }

    @Test
    void configure_正常ケース_DQEスイッチのみ正の値_トレースが有効化されること() {
        ConfigurationSection root =
                parse("LLBLGen:\n  Tracing:\n    Switches:\n      SqlServerDQE: 4\n");

        ConfigurationApplier.configure(target, root);

        assertEquals(TraceLevel.VERBOSE, target.getDqe().getTraceLevel());
        assertTrue(target.getTracing().isTraceEnabled());
    }

    @Test
    void configure_正常ケース_ルートに接続文字列がある_LLBLGen配下は参照されないこと() {
        ConfigurationSection root = parse("ConnectionStrings:\n"
                + "  Northwind: 'Server=a;Database=b;'\n"
                + "LLBLGen:\n"
                + "  ConnectionStrings:\n"
                + "    Nested: 'Server=c;'\n");

        ConfigurationApplier.configure(target, root);

        assertEquals(Map.of("Northwind.ConnectionString", "Server=a;Database=b;"),
                target.getConnectionStrings().snapshot());
    }

    @Test
    void configure_正常ケース_ルートに接続文字列がない_LLBLGen配下が登録されること() {
        ConfigurationSection root = parse("LLBLGen:\n"
                + "  ConnectionStrings:\n"
                + "    Main: 'Server=c;'\n"
                + "    Empty:\n");

        ConfigurationApplier.configure(target, root);

        assertEquals(Map.of("Main.ConnectionString", "Server=c;"),
                target.getConnectionStrings().snapshot());
    }

    @Test
    void configure_正常ケース_DQEの既定値が設定されること() {
        ConfigurationApplier.configure(target, parse("{}"));

        DqeConfiguration dqe = target.getDqe();
        assertEquals(Set.of(ConfigurationApplier.SQL_SERVER_DRIVER), dqe.getDriverClassNames());
        assertEquals(SqlServerCompatibilityLevel.SQL_SERVER_2012,
                dqe.getDefaultCompatibilityLevel());
        assertEquals(TraceLevel.OFF, dqe.getTraceLevel());
    }

    @Test
    void configure_正常ケース_カタログ名上書き_CatalogNameがない項目は読み飛ばされること() {
        ConfigurationSection root = parse("LLBLGen:\n"
                + "  SqlServerCatalogNameOverwrites:\n"
                + "    - CatalogName: Northwind\n"
                + "      Overwrite: NorthwindTest\n"
                + "    - Overwrite: Ignored\n"
                + "    - CatalogName: Sales\n");

        ConfigurationApplier.configure(target, root);

        assertEquals(Map.of("Northwind", "NorthwindTest", "Sales", ""),
                target.getDqe().getCatalogNameOverwrites());
    }

    @Test
    void configure_正常ケース_リスナー設定がない_既存のリスナーが変更されないこと() {
        TraceListener existing = mock(TraceListener.class);
        target.getTracing().getListeners().add(existing);
        ConfigurationSection root =
                parse("LLBLGen:\n  Tracing:\n    Switches:\n      EntityFetch: 3\n");

        ConfigurationApplier.configure(target, root);

        assertTrue(target.getTracing().isTraceEnabled());
        assertEquals(List.of(existing), target.getTracing().getListeners().getListeners());
    }

    @Test
    void configure_正常ケース_既にトレース有効でも文書のスイッチが0_既存のリスナーが変更されないこと() {
        TraceListener host = mock(TraceListener.class);
        target.getTracing().setTraceEnabled(true);
        target.getTracing().getListeners().add(host);
        ConfigurationSection root = parse("LLBLGen:\n"
                + "  Tracing:\n"
                + "    Switches:\n"
                + "      EntityFetch: '0'\n"
                + "    Listeners:\n"
                + "      Console: 'true'\n");

        ConfigurationApplier.configure(target, root);

        assertEquals(List.of(host), target.getTracing().getListeners().getListeners());
        assertTrue(target.getTracing().isTraceEnabled());
    }

    @Test
    void configure_正常ケース_DQEスイッチのみ正の値でリスナー設定あり_リスナーが置き換えられること() {
        target.getTracing().getListeners().add(mock(TraceListener.class));
        ConfigurationSection root = parse("LLBLGen:\n"
                + "  Tracing:\n"
                + "    Switches:\n"
                + "      SqlServerDQE: 1\n"
                + "    Listeners:\n"
                + "      Console: true\n");

        ConfigurationApplier.configure(target, root);

        List<TraceListener> listeners = target.getTracing().getListeners().getListeners();
        assertEquals(1, listeners.size());
        assertTrue(listeners.get(0) instanceof ConsoleTraceListener);
    }

    @Test
    void configure_正常ケース_トレースが無効_リスナー設定があっても変更されないこと() {
        TraceListener existing = mock(TraceListener.class);
        target.getTracing().getListeners().add(existing);
        ConfigurationSection root = parse("LLBLGen:\n"
                + "  Tracing:\n"
                + "    Listeners:\n"
                + "      Console: true\n");

        ConfigurationApplier.configure(target, root);

        assertEquals(List.of(existing), target.getTracing().getListeners().getListeners());
    }

    @Test
    void configure_正常ケース_コンソールとファイルを指定する_既存を消去して両方追加されること() {
        target.getTracing().getListeners().add(mock(TraceListener.class));
        Path logFile = tempDir.resolve("trace.log");
        ConfigurationSection root = parse("LLBLGen:\n"
                + "  Tracing:\n"
                + "    Switches:\n"
                + "      EntityFetch: 1\n"
                + "    Listeners:\n"
                + "      Console: true\n"
                + "      File: '" + logFile + "'\n");

        ConfigurationApplier.configure(target, root);

        List<TraceListener> listeners = target.getTracing().getListeners().getListeners();
        assertEquals(2, listeners.size());
        assertTrue(listeners.get(0) instanceof ConsoleTraceListener);
        assertTrue(listeners.get(1) instanceof FileTraceListener);
        assertEquals(logFile, ((FileTraceListener) listeners.get(1)).getFile());
    }

    @Test
    void configure_正常ケース_Debugを指定する_ファイル名付きデバッグリスナーのみ追加されること() {
        Path logFile = tempDir.resolve("debug.log");
        ConfigurationSection root = parse("LLBLGen:\n"
                + "  Tracing:\n"
                + "    Switches:\n"
                + "      EntityFetch: 1\n"
                + "    Listeners:\n"
                + "      Debug: true\n"
                + "      File: '" + logFile + "'\n");

        ConfigurationApplier.configure(target, root);

        List<TraceListener> listeners = target.getTracing().getListeners().getListeners();
        assertEquals(1, listeners.size());
        DebugTraceListener debug = (DebugTraceListener) listeners.get(0);
        assertEquals(logFile, debug.getLogFile().orElseThrow());
    }

    @Test
    void configure_正常ケース_ファイル名が空_ファイルリスナーが追加されないこと() {
        ConfigurationSection root = parse("LLBLGen:\n"
                + "  Tracing:\n"
                + "    Switches:\n"
                + "      EntityFetch: 1\n"
                + "    Listeners:\n"
                + "      Console: false\n"
                + "      File: ''\n");

        ConfigurationApplier.configure(target, root);

        assertTrue(target.getTracing().getListeners().isEmpty());
    }

    @Test
    void configure_正常ケース_同じ文書を2回適用する_結果が変わらないこと() {
        ConfigurationSection root = parse("ConnectionStrings:\n"
                + "  Main: 'Server=a;'\n"
                + "LLBLGen:\n"
                + "  Tracing:\n"
                + "    Switches:\n"
                + "      EntityFetch: 2\n"
                + "    Listeners:\n"
                + "      Console: true\n"
                + "  SqlServerCatalogNameOverwrites:\n"
                + "    - CatalogName: Northwind\n"
                + "      Overwrite: NorthwindTest\n");

        ConfigurationApplier.configure(target, root);
        ConfigurationApplier.configure(target, root);

        assertEquals(Map.of("Main.ConnectionString", "Server=a;"),
                target.getConnectionStrings().snapshot());
        assertEquals(Map.of("Northwind", "NorthwindTest"),
                target.getDqe().getCatalogNameOverwrites());
        assertEquals(1, target.getDqe().getDriverClassNames().size());
        assertEquals(1, target.getTracing().getListeners().size());
    }

    @Test
    void configure_正常ケース_別々のコンテキストに適用する_互いに影響しないこと() {
        RuntimeConfiguration other = new RuntimeConfiguration();

        ConfigurationApplier.configure(target, parse("ConnectionStrings:\n  Main: 'Server=a;'\n"));

        assertEquals(1, target.getConnectionStrings().size());
        assertEquals(0, other.getConnectionStrings().size());
    }

    @Test
    void configure_正常ケース_リスナー書き込み_モックのリスナーには呼び出しが発生しないこと() {
        TraceListener existing = mock(TraceListener.class);
        target.getTracing().getListeners().add(existing);

        ConfigurationApplier.configure(target, parse("{}"));

        verify(existing, never()).writeLine(anyString());
        assertSame(existing, target.getTracing().getListeners().getListeners().get(0));
    }

    @Test
    void configure_異常ケース_nullを指定する_NullPointerExceptionが送出されること() {
        ConfigurationSection root = parse("{}");
        assertThrows(NullPointerException.class, () -> ConfigurationApplier.configure(null, root));
        assertThrows(NullPointerException.class,
                () -> ConfigurationApplier.configure(target, null));
    }

    @Test
    void configureFromFile_正常ケース_JSONファイルを指定する_内容が適用されること() throws Exception {
        Files.writeString(tempDir.resolve("orm.json"),
                "{\"ConnectionStrings\": {\"Main\": \"Server=json;\"},"
                        + " \"LLBLGen\": {\"Tracing\": {\"Switches\": {\"EntityFetch\": \"3\"}}}}",
                StandardCharsets.UTF_8);

        ConfigurationApplier.configureFromFile(target, "orm.json", tempDir);

        assertEquals("Server=json;",
                target.getConnectionStrings().find("Main.ConnectionString").orElseThrow());
        assertEquals(TraceLevel.INFO, target.getTracing().getTraceLevel("EntityFetch"));
    }

    @Test
    void configureFromFile_正常ケース_タブでインデントされたJSON_内容が適用されること()
            throws Exception {
        Files.writeString(tempDir.resolve("appsettings.json"),
                "{\n\t\"ConnectionStrings\": {\n\t\t\"Main\": \"Server=a;\"\n\t}\n}\n",
                StandardCharsets.UTF_8);

        ConfigurationApplier.configureFromFile(target, "appsettings.json", tempDir);

        assertEquals(Map.of("Main.ConnectionString", "Server=a;"),
                target.getConnectionStrings().snapshot());
    }

    @Test
    void configureFromFile_正常ケース_ファイルが存在しない_既定値のみ適用されること() {
        ConfigurationApplier.configureFromFile(target, "missing.json", tempDir);

        assertEquals(0, target.getConnectionStrings().size());
        assertEquals(SqlServerCompatibilityLevel.SQL_SERVER_2012,
                target.getDqe().getDefaultCompatibilityLevel());
    }

    @Test
    void configureFromFile_異常ケース_不正なファイル_IllegalStateExceptionが送出されること()
            throws Exception {
        Files.writeString(tempDir.resolve("bad.json"), "{\"a\": ", StandardCharsets.UTF_8);

        assertThrows(IllegalStateException.class,
                () -> ConfigurationApplier.configureFromFile(target, "bad.json", tempDir));
    }

    @Test
    void configureFromAppSettings_正常ケース_環境別ファイルがある_後のファイルが優先されること()
            throws Exception {
        Files.writeString(tempDir.resolve("appsettings.json"),
                "{\"ConnectionStrings\": {\"Main\": \"Server=base;\", \"Log\": \"Server=log;\"}}",
                StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("appsettings.Test.yml"),
                "ConnectionStrings:\n  Main: 'Server=test;'\n", StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("appsettings.WS01.json"),
                "{\"LLBLGen\": {\"Tracing\": {\"Switches\": {\"EntityFetch\": \"4\"}}}}",
                StandardCharsets.UTF_8);
        ConfigurationEnvironment environment = new ConfigurationEnvironment(
                Map.of("ORMCONTRIB_ENVIRONMENT", "Test", "COMPUTERNAME", "WS01")::get);

        ConfigurationApplier.configureFromAppSettings(target, tempDir, environment);

        assertEquals(Map.of("Main.ConnectionString", "Server=test;", "Log.ConnectionString",
                "Server=log;"), target.getConnectionStrings().snapshot());
        assertEquals(TraceLevel.VERBOSE, target.getTracing().getTraceLevel("EntityFetch"));
    }

    @Test
    void configure_正常ケース_相対パスのログファイル_パスがそのまま使われること() {
        ConfigurationSection root = parse("LLBLGen:\n"
                + "  Tracing:\n"
                + "    Switches:\n"
                + "      EntityFetch: 1\n"
                + "    Listeners:\n"
                + "      File: logs/trace.log\n");

        ConfigurationApplier.configure(target, root);

        FileTraceListener file =
                (FileTraceListener) target.getTracing().getListeners().getListeners().get(0);
        assertEquals(Paths.get("logs/trace.log"), file.getFile());
    }
}
