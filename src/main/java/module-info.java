// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
module conj {
    requires static org.checkerframework.checker.qual;
    requires static com.github.spotbugs.annotations;
    requires static jsr305;

    exports conj.collection;
    exports conj.comprehension;
    exports conj.destructure;
    exports conj.dispatch;
    exports conj.util;
    exports conj.util.annotation;
    exports conj.util.condition;
    exports conj.value;
}
