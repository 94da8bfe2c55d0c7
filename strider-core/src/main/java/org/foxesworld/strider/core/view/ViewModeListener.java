package org.foxesworld.strider.core.view;

@FunctionalInterface
public interface ViewModeListener {

    void onViewModeChanged(ViewMode from, ViewMode to);
}
