package io.github.suppierk.views.test;

import io.github.suppierk.views.stream.ViewChangeBatch;
import io.github.suppierk.views.stream.ViewChangeStore;
import io.github.suppierk.views.value.InitViewData;
import java.util.ArrayList;
import java.util.List;
import org.jooq.DSLContext;

/** {@link ViewChangeStore} remembering everything it was asked to store. */
public final class RecordingViewChangeStore implements ViewChangeStore {
  public final List<InitViewData> storedInitValues = new ArrayList<>();
  public final List<ViewChangeBatch> appendedBatches = new ArrayList<>();

  @Override
  public void storeInitValues(DSLContext readWriteDsl, List<InitViewData> initValues) {
    storedInitValues.addAll(initValues);
  }

  @Override
  public void appendChanges(DSLContext readWriteDsl, ViewChangeBatch batch) {
    appendedBatches.add(batch);
  }

  public void clear() {
    storedInitValues.clear();
    appendedBatches.clear();
  }
}
