package org.foxesworld.strider.engine;

import com.jme3.system.AppSettings;

public final class StriderLauncher {

    private StriderLauncher() {}

    public static void main(String[] args) {
        StriderApplication app = new StriderApplication();
        AppSettings settings = StriderWindowSettings.build();
        settings.setResolution(1280, 720);
        settings.setRenderer(AppSettings.LWJGL_OPENGL45);
        app.setShowSettings(Boolean.getBoolean("strider.showSettings"));
        app.setSettings(settings);
        app.start();
    }

    static final class StriderWindowSettings {

        private StriderWindowSettings() {}

        static AppSettings build() {
            AppSettings s = new AppSettings(true);
            s.setTitle(StriderVersion.NAME + " " + StriderVersion.VERSION);
            s.setResizable(true);
            s.setVSync(true);
            s.setGammaCorrection(true);
            return s;
        }
    }
}
