/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.monitor.notifier;

import com.google.gson.Gson;
import com.google.gson.annotations.SerializedName;
import java.util.Collections;
import java.util.List;

/**
 * A Slack incoming-webhook message carrying one attachment.
 */
public final class SlackMessage {
    private static final Gson GSON = new Gson();
    @SerializedName("username")
    private final String _username;
    @SerializedName("icon_emoji")
    private final String _iconEmoji;
    @SerializedName("channel")
    private final String _channel;
    @SerializedName("attachments")
    private final List<Attachment> _attachments;

    public SlackMessage(String username, String iconEmoji, String channel, Attachment attachment) {
        _username = username;
        _iconEmoji = iconEmoji;
        _channel = channel;
        _attachments = Collections.singletonList(attachment);
    }

    public String getUsername() {
        return _username;
    }

    public String getIconEmoji() {
        return _iconEmoji;
    }

    public String getChannel() {
        return _channel;
    }

    public Attachment getAttachment() {
        return _attachments.get(0);
    }

    /**
     * @return The JSON body to post to the webhook. Null values are omitted.
     */
    public String toJson() {
        return GSON.toJson(this);
    }

    @Override
    public String toString() {
        return toJson();
    }

    public static final class Attachment {
        @SerializedName("color")
        private final String _color;
        @SerializedName("title")
        private final String _title;
        @SerializedName("text")
        private final String _text;
        @SerializedName("footer")
        private final String _footer;
        @SerializedName("ts")
        private final long _ts;
        @SerializedName("fields")
        private final List<Field> _fields;

        public Attachment(String color, String title, String text, String footer, long ts, List<Field> fields) {
            _color = color;
            _title = title;
            _text = text;
            _footer = footer;
            _ts = ts;
            _fields = fields;
        }

        public String getColor() {
            return _color;
        }

        public String getTitle() {
            return _title;
        }

        public String getText() {
            return _text;
        }

        public long getTs() {
            return _ts;
        }

        public List<Field> getFields() {
            return _fields;
        }
    }

    public static final class Field {
        @SerializedName("title")
        private final String _title;
        @SerializedName("value")
        private final String _value;
        @SerializedName("short")
        private final boolean _short;

        public Field(String title, String value, boolean isShort) {
            _title = title;
            _value = value;
            _short = isShort;
        }

        public String getTitle() {
            return _title;
        }

        public String getValue() {
            return _value;
        }

        public boolean isShort() {
            return _short;
        }
    }
}
