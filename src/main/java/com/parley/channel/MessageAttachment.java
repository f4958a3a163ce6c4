package com.parley.channel;

public record MessageAttachment(
        Type type,
        String url,
        String mimeType,
        Double latitude,
        Double longitude
) {

    public enum Type { IMAGE, AUDIO, VIDEO, DOCUMENT, LOCATION }

    public static MessageAttachment media(Type type, String url, String mimeType) {
        return new MessageAttachment(type, url, mimeType, null, null);
    }

    public static MessageAttachment location(double latitude, double longitude) {
        return new MessageAttachment(Type.LOCATION, null, null, latitude, longitude);
    }

    /**
     * Maps a MIME type such as {@code image/jpeg} to an attachment type,
     * falling back to {@link Type#DOCUMENT}.
     */
    public static Type typeForMime(String mimeType) {
        if (mimeType == null) return Type.DOCUMENT;
        if (mimeType.startsWith("image/")) return Type.IMAGE;
        if (mimeType.startsWith("audio/")) return Type.AUDIO;
        if (mimeType.startsWith("video/")) return Type.VIDEO;
        return Type.DOCUMENT;
    }
}
