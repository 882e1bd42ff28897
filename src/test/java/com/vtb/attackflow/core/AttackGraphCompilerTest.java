package com.vtb.attackflow.core;

import com.vtb.attackflow.config.CompilerConfig;
import com.vtb.attackflow.fuzzy.TacticRuleBook;
import com.vtb.attackflow.models.AttackGraph;
import com.vtb.attackflow.models.CompiledModel;
import com.vtb.attackflow.models.NodeFuzzyInfo;
import com.vtb.attackflow.models.ProbabilisticVariable;
import com.vtb.attackflow.models.RecommendationAction;
import com.vtb.attackflow.models.VariableRole;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Сквозные тесты компиляции бандла attack flow
 */
class AttackGraphCompilerTest {

    private static final String PHISHING = "attack-action--00000000-0000-4000-8000-000000000001";
    private static final String OPERATOR = "attack-operator--00000000-0000-4000-8000-000000000005";
    private static final String CONDITION = "attack-condition--00000000-0000-4000-8000-000000000006";
    private static final String LATERAL = "attack-action--00000000-0000-4000-8000-000000000004";

    @Test
    void compileSampleBundle() throws Exception {
        CompiledModel result = new AttackGraphCompiler(CompilerConfig.defaults()).compile(FlowBundleReaderTest.SAMPLE_FLOW);

        assertEquals(7, result.getModel().getVariables().size());
        assertEquals(6, result.getModel().getArcs().size());
        assertEquals(4, result.getFuzzyInfo().size(), "Нечеткие сведения только для тактических действий");
        assertEquals(2, result.getGroups().getLogicGroups().size());
        assertTrue(result.getRecommendations().stream()
            .anyMatch(r -> r.getNodeId().equals(CONDITION) && r.has(RecommendationAction.LOGIC_UNKNOWN)));

        ProbabilisticVariable operator = result.getModel().variableForNode(OPERATOR).orElseThrow();
        assertEquals(VariableRole.LOGIC_AND, operator.getRole());
        assertEquals(25, operator.rowCount(), "Два 5-уровневых входа AND");

        ProbabilisticVariable condition = result.getModel().variableForNode(CONDITION).orElseThrow();
        assertEquals(VariableRole.LOGIC_OR, condition.getRole(), "Условие без типа трактуется как OR");

        ProbabilisticVariable lateral = result.getModel().variableForNode(LATERAL).orElseThrow();
        assertEquals(List.of(condition.getId()), lateral.getParents());
        assertEquals(5, lateral.cardinality());
        assertEquals(2, lateral.rowCount());
        assertEquals("attack_action__00000000_0000_4000_8000_000000000004", lateral.getId());
    }

    @Test
    void phishingInitialAccessFavorsMediumOverVeryLow() throws Exception {
        CompiledModel result = new AttackGraphCompiler(CompilerConfig.defaults()).compile(FlowBundleReaderTest.SAMPLE_FLOW);

        NodeFuzzyInfo phishing = result.getFuzzyInfo().get(PHISHING);
        assertEquals("Initial Access", phishing.getTacticName());
        assertEquals(50.0, phishing.getParameters().get(TacticRuleBook.DETECTION), "T1566 снижает сложность обнаружения");
        double[] membership = phishing.getMembership();
        assertTrue(membership[2] + membership[3] > membership[0]);
        assertEquals(2, phishing.mostLikelyState());
    }

    @Test
    void compileIsRepeatable() throws Exception {
        AttackGraphCompiler compiler = new AttackGraphCompiler(CompilerConfig.defaults());

        CompiledModel first = compiler.compile(FlowBundleReaderTest.SAMPLE_FLOW);
        CompiledModel second = compiler.compile(FlowBundleReaderTest.SAMPLE_FLOW);

        assertEquals(first.getModel(), second.getModel());
    }

    @Test
    void invalidInput() {
        AttackGraphCompiler compiler = new AttackGraphCompiler(null);

        assertNotNull(compiler.getConfig(), "Без конфигурации используются значения по умолчанию");
        assertThrows(GraphCompilationException.class, () -> compiler.compile(List.of()));
        assertThrows(IllegalArgumentException.class, () -> compiler.compile((AttackGraph) null));
    }
}
