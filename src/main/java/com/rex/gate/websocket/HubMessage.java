package com.rex.gate.websocket;

/**
 * JSON frame sent to websocket clients, also the payload accepted by the event bridge
 *
 * S -> C {"type":"connected", "message":"ok"}
 * S -> C {"type":"play_audio", "sound":"count", "count":7}
 *
 * The sound is one of count, milestone or succeed, count is optional.
 */
public class HubMessage {

    public static final String TYPE_CONNECTED = "connected";
    public static final String TYPE_PLAY_AUDIO = "play_audio";

    public static final String SOUND_COUNT = "count";
    public static final String SOUND_MILESTONE = "milestone";
    public static final String SOUND_SUCCEED = "succeed";

    public String type;
    public String message;
    public String sound;
    public Integer count;

    public static HubMessage connected() {
        HubMessage msg = new HubMessage();
        msg.type = TYPE_CONNECTED;
        msg.message = "ok";
        return msg;
    }

    public static HubMessage playAudio(String sound, Integer count) {
        HubMessage msg = new HubMessage();
        msg.type = TYPE_PLAY_AUDIO;
        msg.sound = sound;
        msg.count = count;
        return msg;
    }

    public static boolean isKnownSound(String sound) {
        return SOUND_COUNT.equals(sound) || SOUND_MILESTONE.equals(sound) || SOUND_SUCCEED.equals(sound);
    }

    @Override
    public String toString() {
        return "<@" + Integer.toHexString(hashCode()) + " type:" + type + " sound:" + sound + " count:" + count + ">";
    }
}
