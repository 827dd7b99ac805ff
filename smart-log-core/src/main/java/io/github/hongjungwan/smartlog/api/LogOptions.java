package io.github.hongjungwan.smartlog.api;

import lombok.Getter;

/**
 * 호출별 override. 명시적 file/line/function과 data를 전달한다.
 *
 * <p>data를 지정하면 위치 인자로 받은 data보다 우선한다. 명시적 null도 값으로 취급.</p>
 */
@Getter
public final class LogOptions {

    private static final LogOptions NONE = new LogOptions(new Builder());

    private final String file;
    private final int line;
    private final String function;
    private final Object data;

    private LogOptions(Builder builder) {
        this.file = builder.file;
        this.line = builder.line;
        this.function = builder.function;
        this.data = builder.data;
    }

    public static LogOptions none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** file/line만 지정 */
    public static LogOptions at(String file, int line) {
        return builder().file(file).line(line).build();
    }

    public boolean hasLocation() {
        return file != null;
    }

    public boolean hasData() {
        return data != NoData.INSTANCE;
    }

    public static final class Builder {
        private String file;
        private int line;
        private String function;
        private Object data = NoData.INSTANCE;

        private Builder() {}

        public Builder file(String file) {
            this.file = file;
            return this;
        }

        public Builder line(int line) {
            this.line = line;
            return this;
        }

        public Builder function(String function) {
            this.function = function;
            return this;
        }

        public Builder data(Object data) {
            this.data = data;
            return this;
        }

        public LogOptions build() {
            return new LogOptions(this);
        }
    }
}
