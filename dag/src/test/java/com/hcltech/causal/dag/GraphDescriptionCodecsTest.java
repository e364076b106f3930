package com.hcltech.causal.dag;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hcltech.causal.dag.CausalGraphFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class GraphDescriptionCodecsTest {

    @Nested
    class Json {
        @Test
        void decodesVariablesAndEdges() {
            String json = "{\"variables\":[\"C\",\"X\",\"Y\"],"
                    + "\"edges\":[{\"from\":\"C\",\"to\":\"X\"},{\"from\":\"C\",\"to\":\"Y\"},{\"from\":\"X\",\"to\":\"Y\"}]}";
            assertEquals(confounded(), GraphDescriptionCodecs.parse(GraphDescriptionCodecs.json(), json).valueOrThrow());
        }

        @Test
        void missingEdges_meansNoEdges() {
            var d = GraphDescriptionCodecs.json().decode("{\"variables\":[\"A\"]}").valueOrThrow();
            assertEquals(new GraphDescription(List.of("A"), List.of()), d);
        }

        @Test
        void encodesInStableFieldOrder() {
            String json = GraphDescriptionCodecs.json().encode(GraphDescription.of(chain())).valueOrThrow();
            assertEquals("{\"variables\":[\"A\",\"B\",\"C\"],\"edges\":[{\"from\":\"A\",\"to\":\"B\"},{\"from\":\"B\",\"to\":\"C\"}]}", json);
        }

        @Test
        void edgeMissingAnEndpoint_isADecodeError() {
            var res = GraphDescriptionCodecs.json().decode("{\"variables\":[\"A\"],\"edges\":[{\"from\":\"A\"}]}");
            assertTrue(res.isError());
        }

        @Test
        void cyclicDescription_isABuildError() {
            String json = "{\"variables\":[\"A\",\"B\"],\"edges\":[{\"from\":\"A\",\"to\":\"B\"},{\"from\":\"B\",\"to\":\"A\"}]}";
            var errs = GraphDescriptionCodecs.parse(GraphDescriptionCodecs.json(), json).errorsOrThrow();
            assertTrue(errs.get(0).contains("cycle"), errs.toString());
        }
    }

    @Nested
    class EdgeList {
        @Test
        void decodesArrowsCommentsAndIsolatedVariables() {
            String text = "# smoking study\n"
                    + "Smoking -> Tar\n"
                    + "\n"
                    + "Tar->Cancer\n"
                    + "  Genotype  \n";
            var d = GraphDescriptionCodecs.edgeList().decode(text).valueOrThrow();
            assertEquals(List.of("Smoking", "Tar", "Cancer", "Genotype"), d.variables());
            assertEquals(List.of(new Edge("Smoking", "Tar"), new Edge("Tar", "Cancer")), d.edges());
        }

        @Test
        void badLines_areReportedWithLineNumbers() {
            var errs = GraphDescriptionCodecs.edgeList().decode("A -> B\n -> C\nA -> B -> C\nbad name").errorsOrThrow();
            assertEquals(3, errs.size(), errs.toString());
            assertTrue(errs.get(0).startsWith("line 2: Missing variable name"), errs.get(0));
            assertTrue(errs.get(1).startsWith("line 3: Expected a single '->'"), errs.get(1));
            assertTrue(errs.get(2).startsWith("line 4: Invalid variable name 'bad name'"), errs.get(2));
        }

        @Test
        void encodeThenParse_rebuildsTheSameTopology() {
            var g = sprinkler();
            String text = GraphDescriptionCodecs.edgeList().encode(GraphDescription.of(g)).valueOrThrow();
            assertEquals(g, GraphDescriptionCodecs.parse(GraphDescriptionCodecs.edgeList(), text).valueOrThrow());
        }

        @Test
        void isolatedVariables_areWrittenAsBareNames() {
            var g = CausalGraph.create("A", "B", "Lonely").addEdge("A", "B");
            assertEquals("A -> B\nLonely", GraphDescriptionCodecs.edgeList().encode(GraphDescription.of(g)).valueOrThrow());
        }

        @Test
        void namesThatCannotBeWritten_areEncodeErrors() {
            var d = new GraphDescription(List.of("has space"), List.of());
            assertTrue(GraphDescriptionCodecs.edgeList().encode(d).isError());
        }
    }
}
