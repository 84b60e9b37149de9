package com.github.mealymachine;

import org.openjdk.jmh.annotations.Benchmark;

import com.github.mealymachine.CandyMachineTest.Coin;

public class MealyMachineBenchmarkTest {

  @Benchmark
  public void testCandyMachineRun() throws MealyMachineException {
    // 1. build the machine with a recording observer
    final RecordingObserver<CandyMachineTest.Candy> observer = new RecordingObserver<>();
    final MealyMachine<Coin, Void, CandyMachineTest.Candy> machine =
        CandyMachineTest.candyMachine(observer);

    // 2. start it
    machine.start(CandyMachineTest.zero);

    // 3. Zero->Five->Fifteen->Zero
    machine.step(Coin.NICKEL);
    machine.step(Coin.DIME);
    machine.step(Coin.QUARTER);

    // 4. Zero->Ten->Zero
    machine.step(Coin.DIME);
    machine.step(Coin.DIME);
  }

  @Benchmark
  public void testSignalMachineRun() throws MealyMachineException {
    final MealyMachine<Integer, Void, Integer> machine =
        SignalProcessingMachineTest.signalMachine();
    machine.start("a");
    for (int iter = 0; iter < 100; iter++) {
      machine.step(iter % 2);
    }
  }

  public static void main(String args[]) throws MealyMachineException {
    MealyMachineBenchmarkTest test = new MealyMachineBenchmarkTest();
    test.testCandyMachineRun();
    test.testSignalMachineRun();
  }

}
