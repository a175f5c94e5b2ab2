package com.edge.aoi.core.parser;

import com.edge.aoi.core.xml.XmlDocumentReader;
import com.edge.aoi.core.xml.XmlNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GlobalInformationInterpreterTest {

    private GlobalInformationInterpreter interpreter;

    @BeforeEach
    void setUp() {
        interpreter = new GlobalInformationInterpreter();
    }

    private static XmlNode read(String xml) throws Exception {
        return XmlDocumentReader.read(xml.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("AOI 日志：程序名和检测时间")
    void aoiGlobalInformation() throws Exception {
        GlobalInformation info = interpreter.interpret(read("""
                <Root><GlobalInformation>
                  <Program><InspectionPlanName>PLAN_A</InspectionPlanName></Program>
                  <Inspection><Date><End>20240301</End></Date><Time><End>080000</End></Time></Inspection>
                </GlobalInformation></Root>
                """));

        assertThat(info.getProgram()).isEqualTo("PLAN_A");
        assertThat(info.getInspectionTime()).isEqualTo(LocalDateTime.of(2024, 3, 1, 8, 0, 0));
        assertThat(info.getKind()).isEqualTo(DocumentKind.AOI_AXI);
        assertThat(info.getOperator()).isEmpty();
        assertThat(info.getRepairTime()).isNull();
        interpreter.validate(info);
    }

    @Test
    @DisplayName("存在 Repair 元素即为维修日志，操作员转大写")
    void repairGlobalInformation() throws Exception {
        GlobalInformation info = interpreter.interpret(read("""
                <Root><GlobalInformation>
                  <Program><InspectionPlanName>PLAN_A</InspectionPlanName></Program>
                  <Inspection><Date><End>20240301</End></Date><Time><End>080000</End></Time></Inspection>
                  <Repair>
                    <OperatorName>nagy.anna</OperatorName>
                    <Date><End>20240301</End></Date><Time><End>093000</End></Time>
                  </Repair>
                </GlobalInformation></Root>
                """));

        assertThat(info.getKind()).isEqualTo(DocumentKind.REPAIR);
        assertThat(info.isRepair()).isTrue();
        assertThat(info.getOperator()).isEqualTo("NAGY.ANNA");
        assertThat(info.getRepairTime()).isEqualTo(LocalDateTime.of(2024, 3, 1, 9, 30, 0));
        interpreter.validate(info);
    }

    @Test
    @DisplayName("缺少 GlobalInformation 段")
    void missingSection() {
        assertThatThrownBy(() -> interpreter.interpret(read("<Root><PCBInformation/></Root>")))
                .isInstanceOfSatisfying(LogParseException.class, e -> assertThat(e.getType()).isEqualTo(ParseErrorType.MISSING_MANDATORY_SECTION));
    }

    @Test
    @DisplayName("程序名为空")
    void emptyProgram() throws Exception {
        GlobalInformation info = interpreter.interpret(read("""
                <Root><GlobalInformation>
                  <Program><InspectionPlanName></InspectionPlanName></Program>
                  <Inspection><Date><End>20240301</End></Date><Time><End>080000</End></Time></Inspection>
                </GlobalInformation></Root>
                """));

        assertThatThrownBy(() -> interpreter.validate(info))
                .isInstanceOfSatisfying(LogParseException.class, e -> assertThat(e.getType()).isEqualTo(ParseErrorType.MISSING_MANDATORY_FIELD));
    }

    @Test
    @DisplayName("检测时间为空")
    void missingInspectionTime() throws Exception {
        GlobalInformation info = interpreter.interpret(read("""
                <Root><GlobalInformation>
                  <Program><InspectionPlanName>PLAN_A</InspectionPlanName></Program>
                  <Inspection><Date><End></End></Date><Time><End>080000</End></Time></Inspection>
                </GlobalInformation></Root>
                """));

        assertThatThrownBy(() -> interpreter.validate(info))
                .isInstanceOfSatisfying(LogParseException.class, e -> assertThat(e.getType()).isEqualTo(ParseErrorType.INVALID_TIMESTAMP_COMBINATION));
    }

    @Test
    @DisplayName("检测时间早于 2000 年")
    void inspectionTimeBefore2000() throws Exception {
        GlobalInformation info = interpreter.interpret(read("""
                <Root><GlobalInformation>
                  <Program><InspectionPlanName>PLAN_A</InspectionPlanName></Program>
                  <Inspection><Date><End>19991231</End></Date><Time><End>235959</End></Time></Inspection>
                </GlobalInformation></Root>
                """));

        assertThatThrownBy(() -> interpreter.validate(info))
                .isInstanceOfSatisfying(LogParseException.class, e -> assertThat(e.getType()).isEqualTo(ParseErrorType.INVALID_TIMESTAMP_COMBINATION));
    }

    @Test
    @DisplayName("维修日志缺少维修时间")
    void repairWithoutRepairTime() throws Exception {
        GlobalInformation info = interpreter.interpret(read("""
                <Root><GlobalInformation>
                  <Program><InspectionPlanName>PLAN_A</InspectionPlanName></Program>
                  <Inspection><Date><End>20240301</End></Date><Time><End>080000</End></Time></Inspection>
                  <Repair><OperatorName>op</OperatorName></Repair>
                </GlobalInformation></Root>
                """));

        assertThatThrownBy(() -> interpreter.validate(info))
                .isInstanceOfSatisfying(LogParseException.class, e -> {
                    assertThat(e.getType()).isEqualTo(ParseErrorType.INVALID_TIMESTAMP_COMBINATION);
                    assertThat(e.getField()).isEqualTo("Repair");
                });
    }
}
