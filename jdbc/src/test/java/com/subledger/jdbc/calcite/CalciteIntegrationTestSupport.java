package com.subledger.jdbc.calcite;

import com.subledger.engine.SubledgerEngine;
import com.subledger.engine.SubledgerOptions;
import com.subledger.engine.SubledgerResult;
import com.subledger.jdbc.feed.FeedLoader;
import com.subledger.jdbc.testing.TestResources;
import java.util.Properties;

/**
 * Small helper for Calcite integration tests so every test builds the same connection properties
 * and runs the same sample book.
 */
final class CalciteIntegrationTestSupport {

    private CalciteIntegrationTestSupport() {}

    static SubledgerResult sampleRun() throws Exception {
        return new SubledgerEngine(SubledgerOptions.defaults()).run(FeedLoader.load(TestResources.feedDirectory("sample")));
    }

    static Properties newCalciteConnectionProperties(String operandJson) {
        Properties props = new Properties();
        props.setProperty("model", inlineModel(operandJson));
        props.setProperty("lex", "JAVA");
        props.setProperty("quoting", "DOUBLE_QUOTE");
        props.setProperty("caseSensitive", "true");
        return props;
    }

    private static String inlineModel(String operandJson) {
        return """
                inline:{
                  "version":"1.0",
                  "defaultSchema":"subledger",
                  "schemas":[
                    {
                      "type":"custom",
                      "name":"subledger",
                      "factory":"com.subledger.jdbc.calcite.SubledgerSchemaFactory",
                      "operand":%s
                    }
                  ]
                }
                """
                .formatted(operandJson);
    }
}
