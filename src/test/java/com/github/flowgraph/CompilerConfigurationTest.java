package com.github.flowgraph;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.nio.file.Paths;

import org.junit.Test;

import com.github.flowgraph.CompilerConfiguration.CompilerConfigurationBuilder;

public class CompilerConfigurationTest {

  @Test
  public void testDefaults() throws FlowGraphException {
    final CompilerConfiguration config = CompilerConfigurationBuilder.newBuilder()
        .outputDirectory(Paths.get("out")).build();
    assertEquals("", config.getPackageName());
    assertTrue(config.getWriteFlowData());
    assertEquals("flow", config.getFlowDataExtension());
    assertEquals(Paths.get("out"), config.getSourceDirectory());
  }

  @Test
  public void testPackageDirectory() throws FlowGraphException {
    final CompilerConfiguration config = CompilerConfigurationBuilder.newBuilder()
        .outputDirectory(Paths.get("out")).packageName("com.example.ai").writeFlowData(false)
        .build();
    assertEquals(Paths.get("out", "com", "example", "ai"), config.getSourceDirectory());
    assertFalse(config.getWriteFlowData());
  }

  @Test
  public void testValidationCollectsAllProblems() {
    try {
      CompilerConfigurationBuilder.newBuilder().packageName("com.1bad").flowDataExtension("f.l")
          .build();
      fail("Expected invalid configuration");
    } catch (FlowGraphException expected) {
      assertEquals(FlowGraphException.Code.INVALID_COMPILER_CONFIG, expected.getCode());
      assertTrue(expected.getMessage().contains("Output directory"));
      assertTrue(expected.getMessage().contains("com.1bad"));
      assertTrue(expected.getMessage().contains("f.l"));
    }
  }

  @Test
  public void testExtensionIgnoredWithoutFlowData() throws FlowGraphException {
    final CompilerConfiguration config = CompilerConfigurationBuilder.newBuilder()
        .outputDirectory(Paths.get("out")).writeFlowData(false).flowDataExtension("").build();
    assertEquals("", config.getFlowDataExtension());
  }

  @Test(expected = FlowGraphException.class)
  public void testKeywordPackageRejected() throws FlowGraphException {
    CompilerConfigurationBuilder.newBuilder().outputDirectory(Paths.get("out"))
        .packageName("com.class.flows").build();
  }
}
