// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package org.apache.cascades.pattern;

import org.apache.cascades.memo.Group;
import org.apache.cascades.memo.GroupExpression;
import org.apache.cascades.trees.plans.Plan;
import org.apache.cascades.trees.plans.logical.LogicalPlan;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Get all pattern matching subtree in query plan from a group expression.
 */
public class GroupExpressionMatching implements Iterable<Plan> {
    private final Pattern pattern;
    private final GroupExpression groupExpression;

    public GroupExpressionMatching(Pattern pattern, GroupExpression groupExpression) {
        this.pattern = Objects.requireNonNull(pattern, "pattern can not be null");
        this.groupExpression = Objects.requireNonNull(groupExpression, "groupExpression can not be null");
    }

    @Override
    public GroupExpressionIterator iterator() {
        return new GroupExpressionIterator(pattern, groupExpression);
    }

    /**
     * Iterator to get all subtrees. The bindings are computed eagerly, one per combination of
     * matching child bindings.
     */
    public static class GroupExpressionIterator implements Iterator<Plan> {
        private final List<Plan> results = Lists.newArrayList();
        private int resultIndex = 0;

        /**
         * Constructor.
         *
         * @param pattern pattern to match
         * @param groupExpression group expression to be matched
         */
        public GroupExpressionIterator(Pattern pattern, GroupExpression groupExpression) {
            Plan root = groupExpression.getPlan();
            if (!(root instanceof LogicalPlan) || pattern.isGroup() || !pattern.matchRoot(root)) {
                return;
            }
            int childrenGroupArity = groupExpression.arity();
            int patternArity = pattern.arity();

            // a leaf pattern binds the plan with its children left as groups
            if (patternArity == 0) {
                if (pattern.matchPredicates(root)) {
                    results.add(root);
                }
                return;
            }
            if (patternArity != childrenGroupArity) {
                return;
            }

            List<List<Plan>> childrenPlans = Lists.newArrayListWithCapacity(childrenGroupArity);
            for (int i = 0; i < childrenGroupArity; ++i) {
                Group childGroup = groupExpression.child(i);
                List<Plan> childrenPlan = GroupMatching.getAllMatchingPlans(pattern.child(i), childGroup);
                if (childrenPlan.isEmpty()) {
                    // current pattern is match but children patterns not match
                    return;
                }
                childrenPlans.add(childrenPlan);
            }
            assembleAllCombinationPlanTree((LogicalPlan) root, pattern, groupExpression, childrenPlans);
        }

        private void assembleAllCombinationPlanTree(LogicalPlan root, Pattern rootPattern,
                GroupExpression groupExpression, List<List<Plan>> childrenPlans) {
            int childrenPlansSize = childrenPlans.size();
            int[] childrenPlanIndex = new int[childrenPlansSize];
            int offset = 0;
            Optional<GroupExpression> groupExprOption = Optional.of(groupExpression);

            // assemble all combination of plan tree by current root plan and children plan
            while (offset < childrenPlansSize) {
                ImmutableList.Builder<Plan> childrenBuilder = ImmutableList.builder();
                for (int i = 0; i < childrenPlansSize; i++) {
                    childrenBuilder.add(childrenPlans.get(i).get(childrenPlanIndex[i]));
                }
                Plan rootWithChildren = root.withGroupExprAndChildren(groupExprOption, childrenBuilder.build());
                if (rootPattern.matchPredicates(rootWithChildren)) {
                    results.add(rootWithChildren);
                }
                for (offset = 0; offset < childrenPlansSize; offset++) {
                    childrenPlanIndex[offset]++;
                    if (childrenPlanIndex[offset] == childrenPlans.get(offset).size()) {
                        // Reset the index when it reaches the size of the current child plan list
                        childrenPlanIndex[offset] = 0;
                    } else {
                        break;  // Break the loop when there's remaining child plan to process
                    }
                }
            }
        }

        @Override
        public boolean hasNext() {
            return resultIndex < results.size();
        }

        @Override
        public Plan next() {
            if (!hasNext()) {
                throw new NoSuchElementException("GroupExpressionIterator is empty");
            }
            return results.get(resultIndex++);
        }
    }
}
