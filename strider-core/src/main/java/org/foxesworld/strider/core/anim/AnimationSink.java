package org.foxesworld.strider.core.anim;

public interface AnimationSink {

    void setFloat(String name, float value);

    void setBool(String name, boolean value);
}
