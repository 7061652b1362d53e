package com.github.fsm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

import com.github.fsm.StateMachine.StateMachineBuilder;
import com.github.fsm.StateMachineConfiguration.StateMachineConfigurationBuilder;
import com.github.fsm.StateMachineException.Code;

/**
 * Tests for machine configuration, mostly the optional cap on redirect chains.
 */
public class StateMachineConfigurationTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testDefaults() throws StateMachineException {
    final StateMachineConfiguration defaults = StateMachineConfiguration.defaults();
    assertEquals(0, defaults.getMaxRedirectHops());
    assertFalse(defaults.isRedirectGuarded());
    assertEquals("fsm", defaults.getMachineName());

    final StateMachine<Light, FsmProperties<Light>> machine =
        StateMachineBuilder.<Light, FsmProperties<Light>>newBuilder()
            .defaultProperties(light -> new FsmProperties<>()).initialState(Light.RED).build();
    assertEquals(0, machine.getConfiguration().getMaxRedirectHops());
  }

  @Test
  public void testInvalidConfigurations() {
    try {
      StateMachineConfigurationBuilder.newBuilder().maxRedirectHops(-1).build();
      fail("negative maxRedirectHops should be rejected");
    } catch (StateMachineException expected) {
      assertEquals(Code.INVALID_MACHINE_CONFIG, expected.getCode());
    }
    try {
      StateMachineConfigurationBuilder.newBuilder().machineName("  ").build();
      fail("blank machineName should be rejected");
    } catch (StateMachineException expected) {
      assertEquals(Code.INVALID_MACHINE_CONFIG, expected.getCode());
    }
    try {
      StateMachineConfigurationBuilder.newBuilder()
          .machineName("a-machine-name-that-goes-on-for-far-too-long").build();
      fail("overlong machineName should be rejected");
    } catch (StateMachineException expected) {
      assertEquals(Code.INVALID_MACHINE_CONFIG, expected.getCode());
    }
  }

  @Test
  public void testRedirectCycleIsReportedWhenGuarded() throws StateMachineException {
    final AtomicInteger entries = new AtomicInteger();
    final StateMachineConfiguration config = StateMachineConfigurationBuilder.newBuilder()
        .machineName(" traffic ").maxRedirectHops(5).build();
    assertTrue(config.isRedirectGuarded());
    assertEquals("traffic", config.getMachineName());

    // GREEN and AMBER keep bouncing the machine to each other
    final StateMachine<Light, FsmProperties<Light>> machine =
        StateMachineBuilder.<Light, FsmProperties<Light>>newBuilder().config(config)
            .state(Light.RED, new FsmProperties<Light>())
            .state(Light.GREEN, new FsmProperties<Light>(() -> {
              entries.incrementAndGet();
              return Light.AMBER;
            }, null)).state(Light.AMBER, new FsmProperties<Light>(() -> {
              entries.incrementAndGet();
              return Light.GREEN;
            }, null)).defaultProperties(light -> new FsmProperties<>())
            .initialState(Light.RED).build();

    try {
      machine.setState(Light.GREEN);
      fail("redirect cycle should have been cut off");
    } catch (StateMachineException expected) {
      assertEquals(Code.REDIRECT_LIMIT_EXCEEDED, expected.getCode());
    }
    // five hops followed, the sixth refused
    assertEquals(6, entries.get());
    assertEquals(Light.RED, machine.getCurrentState());
    assertEquals(1L, machine.getStatistics().getTransitionFailures());
  }

  @Test
  public void testRedirectChainWithinLimitSucceeds() throws StateMachineException {
    final StateMachineConfiguration config =
        StateMachineConfigurationBuilder.newBuilder().maxRedirectHops(2).build();
    final StateMachine<Light, FsmProperties<Light>> machine =
        StateMachineBuilder.<Light, FsmProperties<Light>>newBuilder().config(config)
            .state(Light.RED, new FsmProperties<Light>(() -> Light.AMBER, null))
            .state(Light.AMBER, new FsmProperties<Light>(() -> Light.GREEN, null))
            .state(Light.GREEN, new FsmProperties<Light>())
            .defaultProperties(light -> new FsmProperties<>()).initialState(Light.GREEN).build();

    machine.setState(Light.RED);
    assertEquals(Light.GREEN, machine.getCurrentState());
    assertEquals(2L, machine.getStatistics().getTotalRedirects());
  }

  public static enum Light {
    RED, AMBER, GREEN;
  }

}
